package com.webparser.prettify;

/**
 * A run of output text with the innermost style scope active over it.
 */
public record StyledSpan(Scope scope, String text) {
}
