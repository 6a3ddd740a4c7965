package com.webparser.ast;

import com.webparser.Token;
import com.webparser.prettify.Prettifier;

/**
 * A statement label, {@code done:}.
 */
public record Label(Token name) implements WebStatement {

    @Override
    public int measureInline() {
        return name.text().length() + 1;
    }

    @Override
    public void renderInline(Prettifier dest) {
        dest.scopePush(dest.scopes().labelName(), name.text());
        dest.noscopePush(':');
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
