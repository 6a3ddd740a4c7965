package com.webparser.ast;

import com.webparser.prettify.Prettifier;

public record RangeType(RangeBound from, RangeBound to) implements WebType {

    @Override
    public int measureInline() {
        return from.measureInline() + to.measureInline() + 4;
    }

    @Override
    public void renderInline(Prettifier dest) {
        from.renderInline(dest);
        dest.noscopePush(" .. ");
        to.renderInline(dest);
    }

    @Override
    public void renderFlex(Prettifier dest) {
        if (dest.fits(measureInline())) {
            renderInline(dest);
            return;
        }

        from.renderInline(dest);
        dest.indentSmall();
        dest.newlineNeeded();
        dest.noscopePush(".. ");
        to.renderInline(dest);
        dest.dedentSmall();
    }
}
