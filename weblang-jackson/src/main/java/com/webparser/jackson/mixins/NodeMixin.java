package com.webparser.jackson.mixins;

import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Tags every syntax node with its simple class name under {@code "type"}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.SIMPLE_NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
public interface NodeMixin {
}
