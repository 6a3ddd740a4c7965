package com.webparser.ast;

import com.webparser.Token;
import com.webparser.prettify.Prettifier;
import com.webparser.prettify.RenderInline;

import java.util.List;

/**
 * A case arm appearing on its own, outside any case statement. WEB programs do
 * this when a module supplies some of the arms of a case elsewhere.
 */
public record FreeCase(List<Token> matches, WebStatement statement) implements WebStatement {

    public FreeCase {
        matches = List.copyOf(matches);
    }

    @Override
    public int measureInline() {
        return RenderInline.measureInlineSeq(matches, 2) + 2 + StatementLayout.nestedWidth(statement);
    }

    @Override
    public void renderInline(Prettifier dest) {
        RenderInline.renderInlineSeq(matches, ", ", dest);
        dest.noscopePush(": ");
        statement.renderInline(dest);
    }

    @Override
    public void renderFlex(Prettifier dest) {
        RenderInline.renderInlineSeq(matches, ", ", dest);
        dest.noscopePush(':');
        StatementLayout.renderNested(statement, dest, false);
    }
}
