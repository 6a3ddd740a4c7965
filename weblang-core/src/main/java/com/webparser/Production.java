package com.webparser;

/**
 * A grammar production. Fails by throwing {@link ExpectedTokenException}.
 */
@FunctionalInterface
public interface Production<T> {
    Parsed<T> parse(TokenCursor input);
}
