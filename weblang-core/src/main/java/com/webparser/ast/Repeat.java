package com.webparser.ast;

import com.webparser.prettify.Prettifier;

import java.util.List;

/**
 * {@code repeat stmts until test}.
 */
public record Repeat(List<WebStatement> statements, WebExpr until) implements WebStatement {

    public Repeat {
        statements = List.copyOf(statements);
    }

    @Override
    public int measureInline() {
        if (!statements.isEmpty()) {
            return Prettifier.NOT_INLINE;
        }
        return 13 + until.measureInline();
    }

    @Override
    public void renderInline(Prettifier dest) {
        dest.keyword("repeat");
        dest.space();
        dest.keyword("until");
        dest.space();
        until.renderInline(dest);
    }

    @Override
    public void renderFlex(Prettifier dest) {
        dest.keyword("repeat");
        dest.indentBlock();

        for (WebStatement s : statements) {
            dest.newlineNeeded();
            StatementLayout.render(s, dest, true);
        }

        dest.dedentBlock();
        dest.newlineNeeded();
        dest.keyword("until");
        dest.space();
        until.renderFitting(dest);
    }
}
