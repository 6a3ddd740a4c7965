package com.webparser.ast;

import com.webparser.prettify.Prettifier;
import com.webparser.prettify.RenderInline;

import java.util.List;

/**
 * A comma-separated expression list forming a whole macro body.
 */
public record SpecialCommaExprs(List<WebExpr> exprs, boolean trailingComma) implements WebToplevel {

    public SpecialCommaExprs {
        exprs = List.copyOf(exprs);
    }

    @Override
    public void prettify(Prettifier dest) {
        int w = RenderInline.measureInlineSeq(exprs, 2) + (trailingComma ? 1 : 0);

        if (dest.fits(w)) {
            RenderInline.renderInlineSeq(exprs, ", ", dest);
            if (trailingComma) {
                dest.noscopePush(',');
            }
            return;
        }

        for (int i = 0; i < exprs.size(); i++) {
            if (i > 0) {
                dest.noscopePush(',');
                dest.newlineNeeded();
            }
            exprs.get(i).renderFitting(dest);
        }
        if (trailingComma) {
            dest.noscopePush(',');
        }
    }
}
