package com.webparser.ast;

import com.webparser.Token;
import com.webparser.prettify.Prettifier;

/**
 * {@code type name = T;}
 */
public record TypeDeclaration(Token name, WebType definition, Token comment) implements WebToplevel {

    @Override
    public void prettify(Prettifier dest) {
        dest.keyword("type");
        dest.space();
        name.renderInline(dest);
        dest.noscopePush(" = ");
        definition.renderFitting(dest, 1);
        dest.noscopePush(';');
        StatementLayout.renderTrailingComment(comment, dest);
    }
}
