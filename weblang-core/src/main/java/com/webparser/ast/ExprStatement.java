package com.webparser.ast;

import com.webparser.Token;
import com.webparser.prettify.Prettifier;

public record ExprStatement(WebExpr expr, Token comment) implements WebStatement {

    @Override
    public int measureInline() {
        return expr.measureInline();
    }

    @Override
    public void renderInline(Prettifier dest) {
        expr.renderInline(dest);
    }

    @Override
    public void renderFlex(Prettifier dest) {
        expr.renderFlex(dest);
    }
}
