package com.webparser;

/**
 * Local failure of a production. Alternatives catch it and move on, so it
 * carries no stack trace.
 */
public class ExpectedTokenException extends RuntimeException {
    private final ParseErrorKind kind;
    private final transient TokenCursor cursor;

    public ExpectedTokenException(ParseErrorKind kind, TokenCursor cursor) {
        super(kind + " at token " + cursor.position(), null, false, false);
        this.kind = kind;
        this.cursor = cursor;
    }

    public ParseErrorKind kind() {
        return kind;
    }

    public TokenCursor cursor() {
        return cursor;
    }
}
