package com.webparser.ast;

import com.webparser.prettify.Prettifier;

public record While(WebExpr test, WebStatement body) implements WebStatement {

    @Override
    public int measureInline() {
        return 6 + test.measureInline() + 4 + StatementLayout.nestedWidth(body);
    }

    @Override
    public void renderInline(Prettifier dest) {
        dest.keyword("while");
        dest.space();
        test.renderInline(dest);
        dest.space();
        dest.keyword("do");
        dest.space();
        body.renderInline(dest);
    }

    @Override
    public void renderFlex(Prettifier dest) {
        dest.keyword("while");
        dest.space();
        if (dest.fits(test.measureInline() + 3)) {
            test.renderInline(dest);
        } else {
            test.renderFlex(dest);
        }
        dest.space();
        dest.keyword("do");
        StatementLayout.renderNested(body, dest, false);
    }
}
