package com.webparser.ast;

import com.webparser.Token;
import com.webparser.prettify.Prettifier;

public record UserDefinedType(Token name) implements WebType {

    @Override
    public int measureInline() {
        return name.text().length();
    }

    @Override
    public void renderInline(Prettifier dest) {
        dest.noscopePush(name.text());
    }
}
