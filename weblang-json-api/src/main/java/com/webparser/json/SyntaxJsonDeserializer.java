package com.webparser.json;

import com.webparser.Token;
import com.webparser.prettify.PrettifierConfig;

import java.util.List;

/**
 * Interface for reading parser input and configuration from JSON.
 */
public interface SyntaxJsonDeserializer {

    /**
     * Reads a token list as produced by the external lexer: an array of
     * objects with {@code type}, {@code text} and optionally {@code word},
     * {@code delimiter}, {@code start} and {@code end}.
     *
     * @param json the JSON array
     * @return the tokens, in order
     * @throws SyntaxJsonException if the JSON is malformed
     */
    List<Token> deserializeTokens(String json) throws SyntaxJsonException;

    /**
     * Reads a layout configuration. Unknown keys are ignored; missing keys take
     * their defaults.
     *
     * @param json a JSON object such as {@code {"fullWidth": 72}}
     * @return the configuration
     * @throws SyntaxJsonException if the JSON is malformed or a value is invalid
     */
    PrettifierConfig deserializeConfig(String json) throws SyntaxJsonException;
}
