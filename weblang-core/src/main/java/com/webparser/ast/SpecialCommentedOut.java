package com.webparser.ast;

import com.webparser.prettify.Prettifier;

/**
 * A statement inside a meta-comment, {@code @{ stmt @}}: code disabled in the
 * compiled program.
 */
public record SpecialCommentedOut(WebStatement statement) implements WebToplevel {

    @Override
    public void prettify(Prettifier dest) {
        dest.withScope(dest.scopes().comment(), () -> {
            dest.noscopePush("/*");
            dest.indentBlock();
            dest.newlineNeeded();
            StatementLayout.render(statement, dest, true);
            dest.dedentBlock();
            dest.newlineNeeded();
            dest.noscopePush("*/");
        });
    }
}
