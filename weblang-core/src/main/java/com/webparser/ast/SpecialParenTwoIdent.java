package com.webparser.ast;

import com.webparser.Token;
import com.webparser.prettify.Prettifier;

/**
 * {@code (a b)}, two identifiers in parentheses, as left by macros that splice
 * a prefix onto a name.
 */
public record SpecialParenTwoIdent(Token first, Token second) implements WebToplevel {

    @Override
    public void prettify(Prettifier dest) {
        dest.noscopePush('(');
        first.renderInline(dest);
        dest.space();
        second.renderInline(dest);
        dest.noscopePush(')');
    }
}
