package com.webparser.ast;

import com.webparser.Token;
import com.webparser.prettify.Prettifier;
import com.webparser.prettify.RenderFlex;
import com.webparser.prettify.RenderInline;

import java.util.List;

/**
 * {@code var? a, b: T} in a parameter list. {@code varWord} is null for value parameters.
 */
public record ParameterGroup(Token varWord, List<Token> names, WebType paramType) implements SyntaxNode, RenderFlex {

    public ParameterGroup {
        names = List.copyOf(names);
    }

    @Override
    public int measureInline() {
        return (varWord != null ? 4 : 0) + RenderInline.measureInlineSeq(names, 2) + 2 + paramType.measureInline();
    }

    @Override
    public void renderInline(Prettifier dest) {
        if (varWord != null) {
            varWord.renderInline(dest);
            dest.space();
        }
        RenderInline.renderInlineSeq(names, ", ", dest);
        dest.noscopePush(": ");
        paramType.renderInline(dest);
    }

    @Override
    public void renderFlex(Prettifier dest) {
        if (varWord != null) {
            varWord.renderInline(dest);
            dest.space();
        }
        RenderInline.renderInlineSeq(names, ", ", dest);
        dest.noscopePush(": ");
        paramType.renderFitting(dest);
    }
}
