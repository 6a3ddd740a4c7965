package com.webparser.ast;

import com.webparser.Token;
import com.webparser.prettify.Prettifier;

/**
 * A field-width suffix as used in {@code write} calls, {@code x:3}.
 */
public record FormatExpr(WebExpr inner, Token width) implements WebExpr {

    @Override
    public int measureInline() {
        return inner.measureInline() + 1 + width.measureInline();
    }

    @Override
    public void renderInline(Prettifier dest) {
        inner.renderInline(dest);
        dest.noscopePush(':');
        width.renderInline(dest);
    }

    @Override
    public void renderFlex(Prettifier dest) {
        inner.renderFitting(dest);
        dest.noscopePush(':');
        width.renderInline(dest);
    }
}
