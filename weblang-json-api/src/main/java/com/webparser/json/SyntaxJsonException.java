package com.webparser.json;

/**
 * Exception thrown when JSON serialization or deserialization fails.
 */
public class SyntaxJsonException extends RuntimeException {

    public SyntaxJsonException(String message) {
        super(message);
    }

    public SyntaxJsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
