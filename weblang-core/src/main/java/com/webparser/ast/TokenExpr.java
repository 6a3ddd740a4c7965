package com.webparser.ast;

import com.webparser.Token;
import com.webparser.prettify.Prettifier;

public record TokenExpr(Token token) implements WebExpr {

    @Override
    public int measureInline() {
        return token.measureInline();
    }

    @Override
    public void renderInline(Prettifier dest) {
        token.renderInline(dest);
    }

    @Override
    public void renderFlex(Prettifier dest) {
        token.renderInline(dest);
    }
}
