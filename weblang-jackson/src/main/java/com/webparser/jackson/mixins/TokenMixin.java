package com.webparser.jackson.mixins;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.webparser.DelimiterKind;
import com.webparser.ReservedWord;
import com.webparser.TokenType;

/**
 * Pins token deserialization to the canonical constructor. Missing
 * {@code word} and {@code delimiter} values are inferred from the text.
 */
public abstract class TokenMixin {

    @JsonCreator
    TokenMixin(@JsonProperty("type") TokenType type,
               @JsonProperty("text") String text,
               @JsonProperty("word") ReservedWord word,
               @JsonProperty("delimiter") DelimiterKind delimiter,
               @JsonProperty("start") int start,
               @JsonProperty("end") int end) {
    }
}
