package com.webparser;

import java.util.ArrayList;
import java.util.List;

/**
 * Primitive matchers and combinators over {@link TokenCursor}.
 *
 * <p>Every matcher either returns a {@link Parsed} or throws
 * {@link ExpectedTokenException}. Because cursors are immutable, backtracking
 * is simply a matter of retrying from the cursor that was passed in.</p>
 */
public final class Combinators {

    private Combinators() {
        // Utility class
    }

    // ========================================================================
    // Token matchers
    // ========================================================================

    public static Parsed<Token> anyToken(TokenCursor in) {
        return new Parsed<>(in.advance(), in.peek());
    }

    public static Parsed<Token> token(TokenCursor in, TokenType type) {
        Token t = in.peek();
        if (t.type() != type) {
            throw new ExpectedTokenException(ParseErrorKind.EXPECTED_PASCAL_TOKEN, in);
        }
        return new Parsed<>(in.advance(), t);
    }

    public static Production<Token> token(TokenType type) {
        return in -> token(in, type);
    }

    /**
     * Matches one token whose type is any of {@code types}.
     */
    public static Parsed<Token> oneOf(TokenCursor in, TokenType... types) {
        Token t = in.peek();
        for (TokenType type : types) {
            if (t.type() == type) {
                return new Parsed<>(in.advance(), t);
            }
        }
        throw new ExpectedTokenException(ParseErrorKind.EOF, in);
    }

    public static Parsed<Token> reservedWord(TokenCursor in, ReservedWord word) {
        Token t = in.peek();
        if (!t.isReserved(word)) {
            throw new ExpectedTokenException(ParseErrorKind.EXPECTED_RESERVED_WORD, in);
        }
        return new Parsed<>(in.advance(), t);
    }

    public static Production<Token> reservedWord(ReservedWord word) {
        return in -> reservedWord(in, word);
    }

    /**
     * Matches an identifier the lexer tagged as behaving like {@code word}.
     */
    public static Parsed<Token> formattedIdentifierLike(TokenCursor in, ReservedWord word) {
        Token t = in.peek();
        if (!t.isFormattedLike(word)) {
            throw new ExpectedTokenException(ParseErrorKind.EOF, in);
        }
        return new Parsed<>(in.advance(), t);
    }

    /**
     * Matches either the reserved word itself or a formatted identifier acting like it.
     */
    public static Parsed<Token> wordOrFormattedLike(TokenCursor in, ReservedWord word) {
        Token t = in.peek();
        if (t.isReserved(word) || t.isFormattedLike(word)) {
            return new Parsed<>(in.advance(), t);
        }
        throw new ExpectedTokenException(ParseErrorKind.EOF, in);
    }

    public static Parsed<Token> identifier(TokenCursor in) {
        Token t = in.peek();
        if (t.type() != TokenType.IDENTIFIER) {
            throw new ExpectedTokenException(ParseErrorKind.EXPECTED_IDENTIFIER, in);
        }
        return new Parsed<>(in.advance(), t);
    }

    public static Parsed<Token> intLiteral(TokenCursor in) {
        Token t = in.peek();
        if (t.type() != TokenType.INT_LITERAL) {
            throw new ExpectedTokenException(ParseErrorKind.EXPECTED_LITERAL, in);
        }
        return new Parsed<>(in.advance(), t);
    }

    /**
     * Matches one or more adjacent string literal tokens and merges them.
     *
     * <p>WEB splits long strings across source lines; the lexer hands the pieces
     * over as separate tokens. A single piece is returned unchanged.</p>
     */
    public static Parsed<Token> mergedStringLiterals(TokenCursor in) {
        Token first = in.peek();
        if (first.type() != TokenType.STRING_LITERAL) {
            throw new ExpectedTokenException(ParseErrorKind.EXPECTED_LITERAL, in);
        }

        TokenCursor c = in.advance();
        if (c.isAtEnd() || c.peek().type() != TokenType.STRING_LITERAL) {
            return new Parsed<>(c, first);
        }

        StringBuilder merged = new StringBuilder(first.text());
        Token last = first;
        while (!c.isAtEnd() && c.peek().type() == TokenType.STRING_LITERAL) {
            last = c.peek();
            merged.append(last.text());
            c = c.advance();
        }

        return new Parsed<>(c, new Token(TokenType.STRING_LITERAL, merged.toString(), null, null, first.start(), last.end()));
    }

    public static Parsed<Token> openDelimiter(TokenCursor in, DelimiterKind kind) {
        Token t = in.peek();
        if (!t.isOpen(kind)) {
            throw new ExpectedTokenException(ParseErrorKind.EXPECTED_DELIMITER, in);
        }
        return new Parsed<>(in.advance(), t);
    }

    public static Parsed<Token> closeDelimiter(TokenCursor in, DelimiterKind kind) {
        Token t = in.peek();
        if (!t.isClose(kind)) {
            throw new ExpectedTokenException(ParseErrorKind.EXPECTED_DELIMITER, in);
        }
        return new Parsed<>(in.advance(), t);
    }

    public static Parsed<Token> comment(TokenCursor in) {
        Token t = in.peek();
        if (t.type() != TokenType.COMMENT) {
            throw new ExpectedTokenException(ParseErrorKind.EXPECTED_COMMENT, in);
        }
        return new Parsed<>(in.advance(), t);
    }

    public static Parsed<Token> moduleReference(TokenCursor in) {
        Token t = in.peek();
        if (t.type() != TokenType.MODULE_REFERENCE) {
            throw new ExpectedTokenException(ParseErrorKind.EXPECTED_MODULE_REFERENCE, in);
        }
        return new Parsed<>(in.advance(), t);
    }

    /**
     * Succeeds without consuming anything if the input is exhausted or the next
     * token starts a new {@code @d} / {@code @f} definition.
     */
    public static Parsed<Void> peekEndOfDefine(TokenCursor in) {
        if (in.isAtEnd()) {
            return new Parsed<>(in, null);
        }
        TokenType next = in.peek().type();
        if (next == TokenType.DEFINE || next == TokenType.FORMAT) {
            return new Parsed<>(in, null);
        }
        throw new ExpectedTokenException(ParseErrorKind.EXPECTED_END_OF_DEFINE, in);
    }

    // ========================================================================
    // Combinators
    // ========================================================================

    /**
     * Tries each alternative in order from the same cursor; the first success wins.
     */
    @SafeVarargs
    public static <T> Parsed<T> alt(TokenCursor in, Production<? extends T>... alternatives) {
        ExpectedTokenException last = null;
        for (Production<? extends T> alternative : alternatives) {
            try {
                Parsed<? extends T> result = alternative.parse(in);
                return new Parsed<>(result.rest(), result.value());
            } catch (ExpectedTokenException e) {
                last = e;
            }
        }
        throw last != null ? last : new ExpectedTokenException(ParseErrorKind.EOF, in);
    }

    /**
     * Optional match. On failure the value is null and the cursor is unchanged.
     */
    public static <T> Parsed<T> opt(TokenCursor in, Production<T> production) {
        try {
            return production.parse(in);
        } catch (ExpectedTokenException e) {
            return new Parsed<>(in, null);
        }
    }

    public static <T> Parsed<List<T>> many0(TokenCursor in, Production<T> production) {
        List<T> items = new ArrayList<>();
        TokenCursor c = in;
        while (true) {
            Parsed<T> next;
            try {
                next = production.parse(c);
            } catch (ExpectedTokenException e) {
                return new Parsed<>(c, items);
            }
            if (next.rest().position() == c.position()) {
                // A production that consumes nothing would loop forever.
                return new Parsed<>(c, items);
            }
            items.add(next.value());
            c = next.rest();
        }
    }

    public static <T> Parsed<List<T>> many1(TokenCursor in, Production<T> production) {
        Parsed<T> first = production.parse(in);
        Parsed<List<T>> rest = many0(first.rest(), production);
        List<T> items = new ArrayList<>();
        items.add(first.value());
        items.addAll(rest.value());
        return new Parsed<>(rest.rest(), items);
    }

    public static <T> Parsed<List<T>> separatedList1(TokenCursor in, TokenType separator, Production<T> element) {
        List<T> items = new ArrayList<>();
        Parsed<T> first = element.parse(in);
        items.add(first.value());
        TokenCursor c = first.rest();

        while (!c.isAtEnd() && c.peek().type() == separator) {
            Parsed<T> next;
            try {
                next = element.parse(c.advance());
            } catch (ExpectedTokenException e) {
                // Leave the separator for the caller.
                break;
            }
            items.add(next.value());
            c = next.rest();
        }

        return new Parsed<>(c, items);
    }

    public static <T> Parsed<List<T>> separatedList0(TokenCursor in, TokenType separator, Production<T> element) {
        try {
            return separatedList1(in, separator, element);
        } catch (ExpectedTokenException e) {
            return new Parsed<>(in, new ArrayList<>());
        }
    }

    /**
     * Skips an optional semicolon.
     */
    public static TokenCursor skipSemicolon(TokenCursor in) {
        if (!in.isAtEnd() && in.peek().type() == TokenType.SEMICOLON) {
            return in.advance();
        }
        return in;
    }
}
