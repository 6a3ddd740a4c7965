package com.webparser.ast;

import com.webparser.prettify.Prettifier;

/**
 * {@code lhs == rhs} appearing outside a definition.
 */
public record SpecialInlineDefine(WebExpr lhs, WebExpr rhs) implements WebToplevel {

    @Override
    public void prettify(Prettifier dest) {
        int w = lhs.measureInline() + 4 + rhs.measureInline();
        if (dest.fits(w)) {
            lhs.renderInline(dest);
            dest.noscopePush(" => ");
            rhs.renderInline(dest);
        } else {
            lhs.renderFitting(dest);
            dest.noscopePush(" =>");
            dest.indentSmall();
            dest.newlineNeeded();
            rhs.renderFitting(dest);
            dest.dedentSmall();
        }
    }
}
