package com.webparser.ast;

import com.webparser.Token;
import com.webparser.prettify.Prettifier;
import com.webparser.prettify.TexInsert;

/**
 * {@code [from .. to] name}, used inside a custom TeX table macro. The brackets
 * are not rendered as text; the emitter produces them from the inserts.
 */
public record SpecialArrayMacro(WebExpr from, WebExpr to, Token name) implements WebToplevel {

    @Override
    public void prettify(Prettifier dest) {
        // At the start of this item's own text, after any pending newline.
        dest.insert(new TexInsert.ArrayMacroMarker(), true);
        from.renderInline(dest);
        dest.noscopePush(" .. ");
        to.renderInline(dest);
        dest.insert(new TexInsert.ArrayMacroBracket(), false);
        // A separate scope forces a span break, so the bracket lands outside any style group.
        dest.keyword(name.text());
    }
}
