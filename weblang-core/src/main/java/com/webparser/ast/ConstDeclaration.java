package com.webparser.ast;

import com.webparser.Token;
import com.webparser.prettify.Prettifier;

/**
 * {@code const name = value;}
 */
public record ConstDeclaration(Token name, Token value, Token comment) implements WebToplevel {

    @Override
    public void prettify(Prettifier dest) {
        dest.keyword("const");
        dest.space();
        name.renderInline(dest);
        dest.noscopePush(" = ");
        value.renderInline(dest);
        dest.noscopePush(';');
        StatementLayout.renderTrailingComment(comment, dest);
    }
}
