package com.webparser.ast;

import com.webparser.Token;
import com.webparser.prettify.Prettifier;

import java.util.List;

/**
 * A procedure or function with its local declarations and body.
 *
 * @param locals label, const, var and modulified declarations, in source order
 */
public record FunctionDefinition(FunctionHeader header, Token comment, List<WebToplevel> locals, Block body)
    implements WebToplevel {

    public FunctionDefinition {
        locals = List.copyOf(locals);
    }

    @Override
    public void prettify(Prettifier dest) {
        header.renderFitting(dest, 1);
        dest.noscopePush(';');
        StatementLayout.renderTrailingComment(comment, dest);

        for (WebToplevel local : locals) {
            dest.newlineNeeded();
            local.prettify(dest);
        }

        dest.newlineNeeded();
        body.renderFlex(dest);
        dest.noscopePush(';');
        StatementLayout.renderTrailingComment(body.comment(), dest);
    }
}
