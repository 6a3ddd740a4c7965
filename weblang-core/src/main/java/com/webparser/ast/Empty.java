package com.webparser.ast;

import com.webparser.prettify.Prettifier;

/**
 * A code section with no tokens in it.
 */
public record Empty() implements WebToplevel {

    @Override
    public void prettify(Prettifier dest) {
        dest.scopePush(dest.scopes().comment(), "/*nothing*/");
    }
}
