package com.webparser.ast;

import com.webparser.Token;
import com.webparser.prettify.Prettifier;

/**
 * {@code for variable := from to|downto to do body}.
 */
public record For(Token variable, WebExpr from, Token direction, WebExpr to, WebStatement body) implements WebStatement {

    private int headerWidth() {
        return 4 + variable.measureInline() + 4 + from.measureInline() + 1
            + direction.measureInline() + 1 + to.measureInline() + 3;
    }

    @Override
    public int measureInline() {
        return headerWidth() + 1 + StatementLayout.nestedWidth(body);
    }

    private void renderHeader(Prettifier dest) {
        dest.keyword("for");
        dest.space();
        variable.renderInline(dest);
        dest.noscopePush(" := ");
        from.renderInline(dest);
        dest.space();
        direction.renderInline(dest);
        dest.space();
        to.renderInline(dest);
        dest.space();
        dest.keyword("do");
    }

    @Override
    public void renderInline(Prettifier dest) {
        renderHeader(dest);
        dest.space();
        body.renderInline(dest);
    }

    @Override
    public void renderFlex(Prettifier dest) {
        if (dest.fits(headerWidth())) {
            renderHeader(dest);
        } else {
            dest.keyword("for");
            dest.space();
            variable.renderInline(dest);
            dest.noscopePush(" :=");
            dest.space();
            from.renderFitting(dest);
            dest.indentSmall();
            dest.newlineNeeded();
            direction.renderInline(dest);
            dest.space();
            to.renderFitting(dest);
            dest.space();
            dest.keyword("do");
            dest.dedentSmall();
        }
        StatementLayout.renderNested(body, dest, false);
    }
}
