package com.webparser.ast;

import com.webparser.Token;
import com.webparser.prettify.Prettifier;
import com.webparser.prettify.RenderInline;

/**
 * A term of a bracketed integer list: {@code 3}, {@code x}, {@code 1 .. 5} or {@code -x}.
 */
public sealed interface ListLiteralTerm extends SyntaxNode, RenderInline {

    record Single(Token value) implements ListLiteralTerm {
        @Override
        public int measureInline() {
            return value.measureInline();
        }

        @Override
        public void renderInline(Prettifier dest) {
            value.renderInline(dest);
        }
    }

    record Range(Token from, Token to) implements ListLiteralTerm {
        @Override
        public int measureInline() {
            return from.measureInline() + 4 + to.measureInline();
        }

        @Override
        public void renderInline(Prettifier dest) {
            from.renderInline(dest);
            dest.noscopePush(" .. ");
            to.renderInline(dest);
        }
    }

    record Unary(Token op, Token operand) implements ListLiteralTerm {
        @Override
        public int measureInline() {
            return op.measureInline() + operand.measureInline();
        }

        @Override
        public void renderInline(Prettifier dest) {
            op.renderInline(dest);
            operand.renderInline(dest);
        }
    }
}
