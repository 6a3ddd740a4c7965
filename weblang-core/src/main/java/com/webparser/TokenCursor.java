package com.webparser;

import java.util.List;

/**
 * An immutable position in a token list.
 *
 * <p>Parsing never mutates tokens; productions hand back advanced cursors.
 * Formatting markers are skipped transparently, so a cursor always rests on a
 * meaningful token or at the end of input.</p>
 */
public record TokenCursor(List<Token> tokens, int position) {

    public TokenCursor {
        while (position < tokens.size() && tokens.get(position).type().isFormattingMarker()) {
            position++;
        }
    }

    public static TokenCursor start(List<Token> tokens) {
        return new TokenCursor(tokens, 0);
    }

    public boolean isAtEnd() {
        return position >= tokens.size();
    }

    /**
     * The current token.
     *
     * @throws ExpectedTokenException with kind EOF at the end of input
     */
    public Token peek() {
        if (isAtEnd()) {
            throw new ExpectedTokenException(ParseErrorKind.EOF, this);
        }
        return tokens.get(position);
    }

    /**
     * The cursor just past the current token.
     */
    public TokenCursor advance() {
        if (isAtEnd()) {
            throw new ExpectedTokenException(ParseErrorKind.EOF, this);
        }
        return new TokenCursor(tokens, position + 1);
    }

    /**
     * Number of tokens from this position to the end, formatting markers included.
     */
    public int remaining() {
        return Math.max(0, tokens.size() - position);
    }

    /**
     * Up to {@code n} tokens from the current position, for diagnostics.
     */
    public List<Token> context(int n) {
        int from = Math.min(position, tokens.size());
        return tokens.subList(from, Math.min(tokens.size(), from + n));
    }

    @Override
    public String toString() {
        return "TokenCursor[" + position + "/" + tokens.size() + "]";
    }
}
