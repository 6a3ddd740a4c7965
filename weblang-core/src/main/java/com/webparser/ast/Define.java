package com.webparser.ast;

import com.webparser.Token;
import com.webparser.TokenType;
import com.webparser.prettify.Prettifier;

/**
 * A macro definition, {@code @d lhs == body} or {@code @d lhs = number}.
 * {@code body} is null for an empty definition.
 */
public record Define(WebExpr lhs, Token equals, WebToplevel body, Token comment) implements WebToplevel {

    public boolean isNumeric() {
        return equals.type() == TokenType.EQUALS;
    }

    @Override
    public void prettify(Prettifier dest) {
        dest.keyword("@define");
        dest.space();
        lhs.renderFitting(dest);
        dest.space();
        dest.noscopePush(isNumeric() ? "=" : "=>");

        if (body != null) {
            dest.space();
            body.prettify(dest);
        }

        StatementLayout.renderTrailingComment(comment, dest);
    }
}
