package com.webparser.ast;

import com.webparser.prettify.Prettifier;

/**
 * {@code if test then stmt (else stmt)?}. {@code otherwise} is null without an else branch.
 */
public record If(WebExpr test, WebStatement then, WebStatement otherwise) implements WebStatement {

    @Override
    public int measureInline() {
        int w = 3 + test.measureInline() + 6 + StatementLayout.nestedWidth(then);
        if (otherwise != null) {
            w += 6 + StatementLayout.nestedWidth(otherwise);
        }
        return w;
    }

    @Override
    public void renderInline(Prettifier dest) {
        dest.keyword("if");
        dest.space();
        test.renderInline(dest);
        dest.space();
        dest.keyword("then");
        dest.space();
        then.renderInline(dest);

        if (otherwise != null) {
            dest.space();
            dest.keyword("else");
            dest.space();
            otherwise.renderInline(dest);
        }
    }

    @Override
    public void renderFlex(Prettifier dest) {
        dest.keyword("if");
        dest.space();
        if (dest.fits(test.measureInline() + 5)) {
            test.renderInline(dest);
        } else {
            test.renderFlex(dest);
        }
        dest.space();
        dest.keyword("then");
        StatementLayout.renderNested(then, dest, false);

        if (otherwise == null) {
            return;
        }

        dest.newlineNeeded();
        dest.keyword("else");

        if (otherwise instanceof If) {
            dest.space();
            StatementLayout.render(otherwise, dest, false);
        } else {
            StatementLayout.renderNested(otherwise, dest, false);
        }
    }
}
