package com.webparser.jackson.mixins;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Writes a scope as its bare name.
 */
public interface ScopeMixin {
    @JsonValue
    String name();
}
