package com.webparser.ast;

import com.webparser.Token;
import com.webparser.prettify.Prettifier;

/**
 * Pointer dereference, {@code p^}.
 */
public record PostfixUnaryExpr(WebExpr inner, Token op) implements WebExpr {

    @Override
    public int measureInline() {
        return inner.measureInline() + op.measureInline();
    }

    @Override
    public void renderInline(Prettifier dest) {
        inner.renderInline(dest);
        op.renderInline(dest);
    }

    @Override
    public void renderFlex(Prettifier dest) {
        inner.renderFitting(dest);
        op.renderInline(dest);
    }
}
