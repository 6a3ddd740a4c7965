package com.webparser.ast;

import com.webparser.Token;
import com.webparser.prettify.Prettifier;

/**
 * A forward declaration bracketed by conditional-compilation macros such as
 * {@code debug ... gubed}.
 */
public record SpecialIfdefForward(Token begin, ForwardDeclaration declaration, Token end) implements WebToplevel {

    @Override
    public void prettify(Prettifier dest) {
        Ifdefs.open(begin, dest);
        declaration.prettify(dest);
        Ifdefs.close(dest);
    }
}
