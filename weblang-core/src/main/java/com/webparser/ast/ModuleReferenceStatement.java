package com.webparser.ast;

import com.webparser.Token;
import com.webparser.prettify.Prettifier;

/**
 * A reference to a module whose code is spliced in at this point.
 */
public record ModuleReferenceStatement(Token module) implements WebStatement {

    @Override
    public int measureInline() {
        return module.measureInline();
    }

    @Override
    public void renderInline(Prettifier dest) {
        module.renderInline(dest);
    }

    @Override
    public void renderFlex(Prettifier dest) {
        renderInline(dest);
    }
}
