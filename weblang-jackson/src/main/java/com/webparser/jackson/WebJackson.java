package com.webparser.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Factory for creating properly configured ObjectMapper instances for syntax tree serialization.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = WebJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(code);
 * </pre>
 */
public final class WebJackson {

    private WebJackson() {
        // Utility class
    }

    /**
     * Creates a new ObjectMapper configured for syntax tree serialization and token input.
     *
     * The returned mapper:
     * - Tags nodes with their kind via the "type" property
     * - Leaves out null fields (absent comments, missing else branches)
     * - Ignores unknown properties in token and configuration input
     *
     * @return A new configured ObjectMapper instance
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new ParameterNamesModule());

        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);

        // Marker nodes such as Empty have no properties besides their type tag
        mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);

        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        mapper.registerModule(new SyntaxModule());

        return mapper;
    }
}
