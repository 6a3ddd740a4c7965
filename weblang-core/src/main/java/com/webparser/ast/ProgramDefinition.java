package com.webparser.ast;

import com.webparser.Token;
import com.webparser.prettify.Prettifier;
import com.webparser.prettify.RenderFlex;

import java.util.List;

/**
 * {@code program name(files);}
 */
public record ProgramDefinition(Token name, List<Token> parameters, Token comment) implements WebToplevel {

    public ProgramDefinition {
        parameters = List.copyOf(parameters);
    }

    @Override
    public void prettify(Prettifier dest) {
        dest.keyword("program");
        dest.space();
        name.renderInline(dest);
        if (!parameters.isEmpty()) {
            RenderFlex.renderDelimited("(", parameters, ")", dest);
        }
        dest.noscopePush(';');
        StatementLayout.renderTrailingComment(comment, dest);
    }
}
