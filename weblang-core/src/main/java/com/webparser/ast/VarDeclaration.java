package com.webparser.ast;

import com.webparser.Token;
import com.webparser.prettify.Prettifier;
import com.webparser.prettify.RenderInline;

import java.util.List;

/**
 * {@code var a, b: T;}
 */
public record VarDeclaration(List<Token> names, WebType varType, Token comment) implements WebToplevel {

    public VarDeclaration {
        names = List.copyOf(names);
    }

    @Override
    public void prettify(Prettifier dest) {
        dest.keyword("var");
        dest.space();
        RenderInline.renderInlineSeq(names, ", ", dest);
        dest.noscopePush(": ");
        varType.renderFitting(dest, 1);
        dest.noscopePush(';');
        StatementLayout.renderTrailingComment(comment, dest);
    }
}
