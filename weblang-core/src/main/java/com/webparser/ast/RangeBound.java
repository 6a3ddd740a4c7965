package com.webparser.ast;

import com.webparser.Token;
import com.webparser.prettify.Prettifier;
import com.webparser.prettify.RenderInline;

/**
 * One end of a subrange type.
 */
public sealed interface RangeBound extends SyntaxNode, RenderInline {

    /** An integer or string literal. */
    record Literal(Token value) implements RangeBound {
        @Override
        public int measureInline() {
            return value.measureInline();
        }

        @Override
        public void renderInline(Prettifier dest) {
            value.renderInline(dest);
        }
    }

    /** A named constant. */
    record Symbolic(Token name) implements RangeBound {
        @Override
        public int measureInline() {
            return name.text().length();
        }

        @Override
        public void renderInline(Prettifier dest) {
            dest.noscopePush(name.text());
        }
    }

    /** {@code name + 1}, rendered parenthesized. */
    record SymbolicOffset(Token name, Token op, Token offset) implements RangeBound {
        @Override
        public int measureInline() {
            return name.text().length() + op.measureInline() + offset.measureInline() + 4;
        }

        @Override
        public void renderInline(Prettifier dest) {
            dest.noscopePush('(');
            dest.noscopePush(name.text());
            dest.space();
            op.renderInline(dest);
            dest.space();
            offset.renderInline(dest);
            dest.noscopePush(')');
        }
    }

    /** {@code -name}. */
    record UnarySymbolic(Token op, Token name) implements RangeBound {
        @Override
        public int measureInline() {
            return op.measureInline() + name.text().length();
        }

        @Override
        public void renderInline(Prettifier dest) {
            op.renderInline(dest);
            dest.noscopePush(name.text());
        }
    }
}
