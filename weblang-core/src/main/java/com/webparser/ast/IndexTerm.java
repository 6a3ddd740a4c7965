package com.webparser.ast;

import com.webparser.prettify.Prettifier;
import com.webparser.prettify.RenderFlex;

/**
 * A term inside an index argument list: an expression or a range.
 */
public sealed interface IndexTerm extends SyntaxNode, RenderFlex {

    record Expr(WebExpr expr) implements IndexTerm {
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
            expr.renderFitting(dest);
        }
    }

    record Range(WebExpr from, WebExpr to) implements IndexTerm {
        @Override
        public int measureInline() {
            return from.measureInline() + 4 + to.measureInline();
        }

        @Override
        public void renderInline(Prettifier dest) {
            from.renderInline(dest);
            dest.noscopePush(" .. ");
            to.renderInline(dest);
        }

        @Override
        public void renderFlex(Prettifier dest) {
            from.renderFitting(dest);
            dest.noscopePush(" ..");

            if (dest.fits(to.measureInline() + 1)) {
                dest.space();
                to.renderInline(dest);
            } else {
                dest.indentSmall();
                dest.newlineNeeded();
                to.renderFitting(dest);
                dest.dedentSmall();
            }
        }
    }
}
