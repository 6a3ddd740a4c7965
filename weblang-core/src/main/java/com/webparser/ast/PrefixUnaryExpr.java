package com.webparser.ast;

import com.webparser.Token;
import com.webparser.TokenType;
import com.webparser.prettify.Prettifier;

/**
 * {@code +x}, {@code -x} or {@code not x}.
 */
public record PrefixUnaryExpr(Token op, WebExpr inner) implements WebExpr {

    private boolean isWord() {
        return op.type() == TokenType.RESERVED_WORD;
    }

    @Override
    public int measureInline() {
        return op.measureInline() + (isWord() ? 1 : 0) + inner.measureInline();
    }

    @Override
    public void renderInline(Prettifier dest) {
        op.renderInline(dest);
        if (isWord()) {
            dest.space();
        }
        inner.renderInline(dest);
    }

    @Override
    public void renderFlex(Prettifier dest) {
        op.renderInline(dest);
        if (isWord()) {
            dest.space();
        }
        inner.renderFitting(dest);
    }
}
