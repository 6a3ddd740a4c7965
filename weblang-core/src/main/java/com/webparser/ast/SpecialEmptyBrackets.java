package com.webparser.ast;

import com.webparser.prettify.Prettifier;

public record SpecialEmptyBrackets() implements WebToplevel {

    @Override
    public void prettify(Prettifier dest) {
        dest.noscopePush("[]");
    }
}
