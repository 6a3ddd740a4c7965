package com.webparser.ast;

import com.webparser.Token;
import com.webparser.prettify.Prettifier;

/**
 * {@code end;} closing a block opened in another macro.
 */
public record SpecialImbalancedEnd(Token end) implements WebToplevel {

    @Override
    public void prettify(Prettifier dest) {
        end.renderInline(dest);
        dest.noscopePush(';');
    }
}
