package com.webparser.ast;

import com.webparser.Token;
import com.webparser.prettify.Prettifier;

import java.util.List;

/**
 * {@code begin ... end}, where either keyword may be a formatted identifier
 * standing in for it.
 */
public record Block(Token opener, List<WebStatement> statements, Token closer, Token comment) implements WebStatement {

    public Block {
        statements = List.copyOf(statements);
    }

    @Override
    public int measureInline() {
        if (!statements.isEmpty()) {
            return Prettifier.NOT_INLINE;
        }
        return opener.measureInline() + 1 + closer.measureInline();
    }

    @Override
    public void renderInline(Prettifier dest) {
        opener.renderInline(dest);
        dest.space();
        closer.renderInline(dest);
    }

    @Override
    public void renderFlex(Prettifier dest) {
        if (statements.isEmpty()) {
            renderInline(dest);
            return;
        }

        opener.renderInline(dest);
        dest.indentBlock();

        for (WebStatement s : statements) {
            dest.newlineNeeded();
            StatementLayout.render(s, dest, true);
        }

        dest.dedentBlock();
        dest.newlineNeeded();
        closer.renderInline(dest);
    }
}
