package com.webparser.ast;

import com.webparser.prettify.Prettifier;
import com.webparser.prettify.RenderFlex;
import com.webparser.prettify.RenderInline;

import java.util.List;

public record CallExpr(WebExpr target, List<WebExpr> args) implements WebExpr {

    public CallExpr {
        args = List.copyOf(args);
    }

    @Override
    public int measureInline() {
        return target.measureInline() + 2 + RenderInline.measureInlineSeq(args, 2);
    }

    @Override
    public void renderInline(Prettifier dest) {
        target.renderInline(dest);
        dest.noscopePush('(');
        RenderInline.renderInlineSeq(args, ", ", dest);
        dest.noscopePush(')');
    }

    @Override
    public void renderFlex(Prettifier dest) {
        if (dest.fits(measureInline())) {
            renderInline(dest);
            return;
        }
        target.renderFitting(dest);
        RenderFlex.renderDelimited("(", args, ")", dest);
    }
}
