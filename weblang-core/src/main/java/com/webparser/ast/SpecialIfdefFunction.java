package com.webparser.ast;

import com.webparser.Token;
import com.webparser.prettify.Prettifier;

public record SpecialIfdefFunction(Token begin, FunctionDefinition definition, Token end) implements WebToplevel {

    @Override
    public void prettify(Prettifier dest) {
        Ifdefs.open(begin, dest);
        definition.prettify(dest);
        Ifdefs.close(dest);
    }
}
