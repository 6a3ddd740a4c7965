package com.webparser.ast;

import com.webparser.prettify.Prettifier;
import com.webparser.prettify.RenderFlex;

import java.util.List;

/**
 * {@code [terms]} or {@code (terms)}.
 */
public record SpecialListLiteral(boolean square, List<ListLiteralTerm> terms) implements WebToplevel {

    public SpecialListLiteral {
        terms = List.copyOf(terms);
    }

    @Override
    public void prettify(Prettifier dest) {
        if (square) {
            RenderFlex.renderDelimited("[", terms, "]", dest);
        } else {
            RenderFlex.renderDelimited("(", terms, ")", dest);
        }
    }
}
