package com.webparser.ast;

import com.webparser.Token;
import com.webparser.prettify.Prettifier;
import com.webparser.prettify.RenderFlex;
import com.webparser.prettify.RenderInline;

import java.util.List;

/**
 * {@code procedure|function name(params): T}. {@code returnType} is null for procedures.
 */
public record FunctionHeader(Token kind, Token name, List<ParameterGroup> params, WebType returnType)
    implements SyntaxNode, RenderFlex {

    public FunctionHeader {
        params = List.copyOf(params);
    }

    @Override
    public int measureInline() {
        int w = kind.measureInline() + 1 + name.measureInline();
        if (!params.isEmpty()) {
            w += 2 + RenderInline.measureInlineSeq(params, 2);
        }
        if (returnType != null) {
            w += 2 + returnType.measureInline();
        }
        return w;
    }

    @Override
    public void renderInline(Prettifier dest) {
        kind.renderInline(dest);
        dest.space();
        name.renderInline(dest);
        if (!params.isEmpty()) {
            dest.noscopePush('(');
            RenderInline.renderInlineSeq(params, "; ", dest);
            dest.noscopePush(')');
        }
        if (returnType != null) {
            dest.noscopePush(": ");
            returnType.renderInline(dest);
        }
    }

    @Override
    public void renderFlex(Prettifier dest) {
        kind.renderInline(dest);
        dest.space();
        name.renderInline(dest);

        if (!params.isEmpty()) {
            dest.noscopePush('(');
            dest.indentBlock();
            for (int i = 0; i < params.size(); i++) {
                dest.newlineNeeded();
                params.get(i).renderFitting(dest);
                if (i < params.size() - 1) {
                    dest.noscopePush(';');
                }
            }
            dest.dedentBlock();
            dest.newlineNeeded();
            dest.noscopePush(')');
        }

        if (returnType != null) {
            dest.noscopePush(": ");
            returnType.renderFitting(dest);
        }
    }
}
