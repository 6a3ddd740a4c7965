package com.webparser.ast;

import com.webparser.Token;
import com.webparser.prettify.Prettifier;

/**
 * A looping construct introduced by a macro such as {@code loop}.
 */
public record Loop(Token keyword, WebStatement body) implements WebStatement {

    @Override
    public int measureInline() {
        return keyword.measureInline() + 1 + StatementLayout.nestedWidth(body);
    }

    @Override
    public void renderInline(Prettifier dest) {
        keyword.renderInline(dest);
        dest.space();
        body.renderInline(dest);
    }

    @Override
    public void renderFlex(Prettifier dest) {
        keyword.renderInline(dest);
        StatementLayout.renderNested(body, dest, false);
    }
}
