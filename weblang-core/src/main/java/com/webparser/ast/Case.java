package com.webparser.ast;

import com.webparser.Token;
import com.webparser.prettify.Prettifier;

import java.util.List;

/**
 * {@code case selector of items terminator}, where the terminator is a
 * formatted identifier acting like {@code end}.
 */
public record Case(WebExpr selector, List<CaseItem> items, Token terminator) implements WebStatement {

    public Case {
        items = List.copyOf(items);
    }

    @Override
    public int measureInline() {
        return Prettifier.NOT_INLINE;
    }

    @Override
    public void renderInline(Prettifier dest) {
        renderFlex(dest);
    }

    @Override
    public void renderFlex(Prettifier dest) {
        dest.keyword("case");
        dest.space();
        selector.renderFitting(dest);
        dest.space();
        dest.keyword("of");
        dest.indentBlock();
        int outer = dest.reserveTrailing(0);

        for (CaseItem item : items) {
            dest.newlineNeeded();
            item.render(dest);
        }

        dest.reserveTrailing(outer);
        dest.dedentBlock();
        dest.newlineNeeded();
        terminator.renderInline(dest);
    }
}
