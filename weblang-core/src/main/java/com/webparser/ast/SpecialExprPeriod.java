package com.webparser.ast;

import com.webparser.prettify.Prettifier;

/**
 * An expression followed by a period, as at the end of the main program.
 */
public record SpecialExprPeriod(WebExpr expr) implements WebToplevel {

    @Override
    public void prettify(Prettifier dest) {
        expr.renderFitting(dest, 1);
        dest.noscopePush('.');
    }
}
