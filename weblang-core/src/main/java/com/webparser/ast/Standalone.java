package com.webparser.ast;

import com.webparser.Token;
import com.webparser.prettify.Prettifier;

/**
 * A single token no other production claimed.
 */
public record Standalone(Token token, Token comment) implements WebToplevel {

    @Override
    public void prettify(Prettifier dest) {
        token.renderInline(dest);
        StatementLayout.renderTrailingComment(comment, dest);
    }
}
