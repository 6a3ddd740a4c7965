package com.webparser.ast;

import com.webparser.Token;
import com.webparser.prettify.Prettifier;

/**
 * A compiler directive in a meta-comment, {@code @{$C-,A+,D-@}}.
 */
public record PreprocessorDirective(Token directive) implements WebStatement {

    @Override
    public int measureInline() {
        return directive.measureInline();
    }

    @Override
    public void renderInline(Prettifier dest) {
        directive.renderInline(dest);
    }

    @Override
    public void renderFlex(Prettifier dest) {
        renderInline(dest);
    }

    @Override
    public boolean wantsSemicolon() {
        return false;
    }
}
