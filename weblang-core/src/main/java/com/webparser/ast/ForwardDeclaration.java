package com.webparser.ast;

import com.webparser.Token;
import com.webparser.prettify.Prettifier;

/**
 * {@code procedure f(...); forward;}
 */
public record ForwardDeclaration(FunctionHeader header, Token comment) implements WebToplevel {

    @Override
    public void prettify(Prettifier dest) {
        // "; forward;"
        header.renderFitting(dest, 10);
        dest.noscopePush(';');
        dest.space();
        dest.keyword("forward");
        dest.noscopePush(';');
        StatementLayout.renderTrailingComment(comment, dest);
    }
}
