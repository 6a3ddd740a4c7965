package com.webparser.prettify;

/**
 * A named style scope, e.g. {@code keyword.control.c}.
 */
public record Scope(String name) {
    public Scope {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("scope name must not be empty");
        }
    }

    @Override
    public String toString() {
        return name;
    }
}
