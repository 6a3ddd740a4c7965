package com.webparser.ast;

import com.webparser.Token;
import com.webparser.prettify.Prettifier;
import com.webparser.prettify.RenderFlex;

import java.util.List;

/**
 * {@code name in [terms]}.
 */
public record SpecialIdentInListLiteral(Token name, List<ListLiteralTerm> terms) implements WebToplevel {

    public SpecialIdentInListLiteral {
        terms = List.copyOf(terms);
    }

    @Override
    public void prettify(Prettifier dest) {
        name.renderInline(dest);
        dest.space();
        dest.keyword("in");
        dest.space();
        RenderFlex.renderDelimited("[", terms, "]", dest);
    }
}
