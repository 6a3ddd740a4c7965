package com.webparser;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a token sequence cannot be parsed in full.
 */
public class ParseException extends RuntimeException {
    private final ParseErrorKind kind;
    private final int position;
    private final List<Token> context;

    public ParseException(ParseErrorKind kind, int position, List<Token> context) {
        super(buildMessage(kind, position, context));
        this.kind = kind;
        this.position = position;
        this.context = List.copyOf(context);
    }

    private static String buildMessage(ParseErrorKind kind, int position, List<Token> context) {
        String near = context.stream().map(Token::toString).collect(Collectors.joining(" "));
        return "Parse failed (" + kind + ") at token " + position + (near.isEmpty() ? "" : " near: " + near);
    }

    public ParseErrorKind kind() {
        return kind;
    }

    public int position() {
        return position;
    }

    public List<Token> context() {
        return context;
    }
}
