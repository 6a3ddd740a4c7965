package com.webparser.ast;

import com.webparser.prettify.Prettifier;

/**
 * {@code from .. to} on its own.
 */
public record SpecialRange(WebExpr from, WebExpr to) implements WebToplevel {

    @Override
    public void prettify(Prettifier dest) {
        int w = from.measureInline() + 4 + to.measureInline();
        if (dest.fits(w)) {
            from.renderInline(dest);
            dest.noscopePush(" .. ");
            to.renderInline(dest);
        } else {
            from.renderFitting(dest);
            dest.indentSmall();
            dest.newlineNeeded();
            dest.noscopePush(".. ");
            to.renderFitting(dest);
            dest.dedentSmall();
        }
    }
}
