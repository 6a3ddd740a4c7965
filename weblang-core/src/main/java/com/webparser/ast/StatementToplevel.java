package com.webparser.ast;

import com.webparser.Token;
import com.webparser.prettify.Prettifier;

public record StatementToplevel(WebStatement statement, Token comment) implements WebToplevel {

    @Override
    public void prettify(Prettifier dest) {
        StatementLayout.render(statement, dest, false);
        StatementLayout.renderTrailingComment(comment, dest);
    }
}
