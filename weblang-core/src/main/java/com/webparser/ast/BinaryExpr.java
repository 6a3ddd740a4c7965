package com.webparser.ast;

import com.webparser.Token;
import com.webparser.prettify.Prettifier;

/**
 * {@code lhs op rhs}. The right-hand side is a full expression, so
 * {@code a + b + c} is {@code a + (b + c)}.
 */
public record BinaryExpr(WebExpr lhs, Token op, WebExpr rhs) implements WebExpr {

    @Override
    public int measureInline() {
        return lhs.measureInline() + op.measureInline() + rhs.measureInline() + 2;
    }

    @Override
    public void renderInline(Prettifier dest) {
        lhs.renderInline(dest);
        dest.space();
        op.renderInline(dest);
        dest.space();
        rhs.renderInline(dest);
    }

    @Override
    public void renderFlex(Prettifier dest) {
        if (dest.fits(measureInline())) {
            renderInline(dest);
            return;
        }

        int wl = lhs.measureInline();
        int wtail = op.measureInline() + 1 + rhs.measureInline();

        if (dest.fits(wl) && dest.wouldFitOnNewLine(wtail + Prettifier.SMALL_STEP)) {
            lhs.renderInline(dest);
            dest.indentSmall();
            dest.newlineNeeded();
            op.renderInline(dest);
            dest.space();
            rhs.renderInline(dest);
            dest.dedentSmall();
            return;
        }

        // One operand per line, operators leading. The chain is right-nested,
        // so walking down the right spine keeps it flat.
        lhs.renderFitting(dest);
        dest.indentSmall();

        Token nextOp = op;
        WebExpr rest = rhs;

        while (true) {
            dest.newlineNeeded();
            nextOp.renderInline(dest);
            dest.space();

            if (rest instanceof BinaryExpr b && !dest.fits(rest.measureInline())) {
                b.lhs().renderFitting(dest);
                nextOp = b.op();
                rest = b.rhs();
            } else {
                rest.renderFitting(dest);
                break;
            }
        }

        dest.dedentSmall();
    }
}
