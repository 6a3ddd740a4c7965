package com.webparser.ast;

import com.webparser.Token;
import com.webparser.prettify.Prettifier;

import java.util.List;

public record LabelDeclaration(List<Token> names, Token comment) implements WebToplevel {

    public LabelDeclaration {
        names = List.copyOf(names);
    }

    @Override
    public void prettify(Prettifier dest) {
        dest.keyword("label");
        dest.space();
        for (int i = 0; i < names.size(); i++) {
            if (i > 0) {
                dest.noscopePush(", ");
            }
            dest.scopePush(dest.scopes().labelName(), names.get(i).text());
        }
        dest.noscopePush(';');
        StatementLayout.renderTrailingComment(comment, dest);
    }
}
