package com.webparser.ast;

import com.webparser.Token;
import com.webparser.prettify.Prettifier;

public record Goto(Token label, Token comment) implements WebStatement {

    @Override
    public int measureInline() {
        return 5 + label.measureInline();
    }

    @Override
    public void renderInline(Prettifier dest) {
        dest.keyword("goto");
        dest.space();
        dest.scopePush(dest.scopes().labelName(), label.text());
    }

    @Override
    public void renderFlex(Prettifier dest) {
        renderInline(dest);
    }
}
