package com.webparser;

/**
 * Successful result of a production: the value and the cursor after it.
 */
public record Parsed<T>(TokenCursor rest, T value) {
}
