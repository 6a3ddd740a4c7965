package com.webparser.ast;

import com.webparser.Token;
import com.webparser.prettify.Prettifier;

/**
 * {@code const}, {@code type} or {@code var} followed by a module holding the declarations.
 */
public record ModulifiedDeclaration(Token keyword, Token module) implements WebToplevel {

    @Override
    public void prettify(Prettifier dest) {
        keyword.renderInline(dest);
        dest.space();
        module.renderInline(dest);
    }
}
