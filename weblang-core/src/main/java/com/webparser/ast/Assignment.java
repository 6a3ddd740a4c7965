package com.webparser.ast;

import com.webparser.Token;
import com.webparser.prettify.Prettifier;

/**
 * {@code lhs := rhs}.
 */
public record Assignment(WebExpr lhs, WebExpr rhs, Token comment) implements WebStatement {

    @Override
    public int measureInline() {
        return lhs.measureInline() + 4 + rhs.measureInline();
    }

    @Override
    public void renderInline(Prettifier dest) {
        lhs.renderInline(dest);
        dest.noscopePush(" := ");
        rhs.renderInline(dest);
    }

    @Override
    public void renderFlex(Prettifier dest) {
        lhs.renderFitting(dest);
        dest.noscopePush(" :=");

        int wr = rhs.measureInline();

        if (dest.fits(wr + 1)) {
            dest.space();
            rhs.renderInline(dest);
        } else if (dest.wouldFitOnNewLine(wr + Prettifier.SMALL_STEP)) {
            dest.indentSmall();
            dest.newlineNeeded();
            rhs.renderInline(dest);
            dest.dedentSmall();
        } else {
            dest.space();
            rhs.renderFlex(dest);
        }
    }
}
