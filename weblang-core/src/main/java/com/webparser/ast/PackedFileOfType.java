package com.webparser.ast;

import com.webparser.Token;
import com.webparser.prettify.Prettifier;

public record PackedFileOfType(Token element) implements WebType {

    @Override
    public int measureInline() {
        return 15 + element.text().length();
    }

    @Override
    public void renderInline(Prettifier dest) {
        dest.noscopePush("packed file of ");
        dest.noscopePush(element.text());
    }
}
