package com.webparser.ast;

import com.webparser.Token;
import com.webparser.prettify.Prettifier;

/**
 * {@code item.field}.
 */
public record FieldAccessExpr(WebExpr item, Token field) implements WebExpr {

    @Override
    public int measureInline() {
        return item.measureInline() + 1 + field.measureInline();
    }

    @Override
    public void renderInline(Prettifier dest) {
        item.renderInline(dest);
        dest.noscopePush('.');
        field.renderInline(dest);
    }

    @Override
    public void renderFlex(Prettifier dest) {
        item.renderFitting(dest);
        dest.noscopePush('.');
        field.renderInline(dest);
    }
}
