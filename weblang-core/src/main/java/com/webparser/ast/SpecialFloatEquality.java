package com.webparser.ast;

import com.webparser.Token;
import com.webparser.prettify.Prettifier;

/**
 * {@code name = .25}, a real constant written without its leading zero.
 */
public record SpecialFloatEquality(Token name, Token fraction) implements WebToplevel {

    @Override
    public void prettify(Prettifier dest) {
        name.renderInline(dest);
        dest.noscopePush(" = ");
        dest.scopePush(dest.scopes().floatLiteral(), "0." + fraction.text());
    }
}
