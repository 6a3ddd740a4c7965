package com.webparser.ast;

import com.webparser.Token;
import com.webparser.prettify.Prettifier;

import java.util.List;

public record SpecialIfdefVarDeclaration(
    Token leadingComment,
    Token begin,
    List<VarDeclaration> declarations,
    Token end,
    Token trailingComment
) implements WebToplevel {

    public SpecialIfdefVarDeclaration {
        declarations = List.copyOf(declarations);
    }

    @Override
    public void prettify(Prettifier dest) {
        if (leadingComment != null) {
            leadingComment.renderInline(dest);
            dest.newlineNeeded();
        }
        if (trailingComment != null) {
            trailingComment.renderInline(dest);
            dest.newlineNeeded();
        }

        Ifdefs.open(begin, dest);
        for (int i = 0; i < declarations.size(); i++) {
            if (i > 0) {
                dest.newlineNeeded();
            }
            declarations.get(i).prettify(dest);
        }
        Ifdefs.close(dest);
    }
}
