package com.webparser.ast;

import com.webparser.prettify.Prettifier;

public record ParenExpr(WebExpr inner) implements WebExpr {

    @Override
    public int measureInline() {
        return inner.measureInline() + 2;
    }

    @Override
    public void renderInline(Prettifier dest) {
        dest.noscopePush('(');
        inner.renderInline(dest);
        dest.noscopePush(')');
    }

    @Override
    public void renderFlex(Prettifier dest) {
        if (dest.fits(measureInline())) {
            renderInline(dest);
            return;
        }
        dest.noscopePush('(');
        dest.indentSmall();
        dest.newlineNeeded();
        inner.renderFitting(dest);
        dest.dedentSmall();
        dest.newlineNeeded();
        dest.noscopePush(')');
    }
}
