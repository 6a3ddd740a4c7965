package com.webparser.ast;

import com.webparser.Token;
import com.webparser.prettify.Prettifier;

/**
 * A format definition, {@code @f lhs == rhs}: typeset {@code lhs} like {@code rhs}.
 */
public record Format(Token lhs, Token rhs, Token comment) implements WebToplevel {

    @Override
    public void prettify(Prettifier dest) {
        dest.keyword("@format");
        dest.space();
        dest.noscopePush(lhs.text());
        dest.noscopePush(" == ");
        rhs.renderInline(dest);
        StatementLayout.renderTrailingComment(comment, dest);
    }
}
