package com.webparser.ast;

import com.webparser.Token;
import com.webparser.prettify.Prettifier;

/**
 * {@code name[2 base]}.
 */
public record SpecialCoeffArray(Token name, Token coeff, Token base) implements WebToplevel {

    @Override
    public void prettify(Prettifier dest) {
        name.renderInline(dest);
        dest.noscopePush('[');
        coeff.renderInline(dest);
        dest.space();
        base.renderInline(dest);
        dest.noscopePush(']');
    }
}
