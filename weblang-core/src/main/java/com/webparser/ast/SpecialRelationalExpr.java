package com.webparser.ast;

import com.webparser.Token;
import com.webparser.prettify.Prettifier;

/**
 * A relational operator with only its right operand, {@code > x}.
 */
public record SpecialRelationalExpr(Token op, WebExpr expr) implements WebToplevel {

    @Override
    public void prettify(Prettifier dest) {
        op.renderInline(dest);
        dest.space();
        expr.renderFitting(dest);
    }
}
