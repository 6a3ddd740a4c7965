package com.webparser.ast;

import com.webparser.prettify.Prettifier;

public record PointerType(WebType target) implements WebType {

    @Override
    public int measureInline() {
        return 1 + target.measureInline();
    }

    @Override
    public void renderInline(Prettifier dest) {
        dest.noscopePush('^');
        target.renderInline(dest);
    }

    @Override
    public void renderFlex(Prettifier dest) {
        dest.noscopePush('^');
        target.renderFitting(dest);
    }
}
