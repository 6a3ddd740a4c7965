package com.webparser.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.webparser.Token;
import com.webparser.ast.SyntaxNode;
import com.webparser.ast.WebCode;
import com.webparser.json.SyntaxJsonDeserializer;
import com.webparser.json.SyntaxJsonException;
import com.webparser.json.SyntaxJsonProvider;
import com.webparser.json.SyntaxJsonSerializer;
import com.webparser.prettify.PrettifiedCode;
import com.webparser.prettify.PrettifierConfig;
import com.webparser.prettify.Scope;
import com.webparser.prettify.ScopeTable;

import java.util.List;

/**
 * Jackson-based implementation of SyntaxJsonProvider.
 */
public class JacksonSyntaxJsonProvider implements SyntaxJsonProvider {

    private final ObjectMapper mapper;
    private final SyntaxJsonSerializer serializer;
    private final SyntaxJsonDeserializer deserializer;

    public JacksonSyntaxJsonProvider() {
        this.mapper = WebJackson.createObjectMapper();
        this.serializer = new JacksonSerializer(mapper);
        this.deserializer = new JacksonDeserializer(mapper);
    }

    @Override
    public SyntaxJsonSerializer getSerializer() {
        return serializer;
    }

    @Override
    public SyntaxJsonDeserializer getDeserializer() {
        return deserializer;
    }

    @Override
    public String getName() {
        return "Jackson";
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getObjectMapper() {
        return mapper;
    }

    // ==================== Inner Classes ====================

    private static class JacksonSerializer implements SyntaxJsonSerializer {
        private final ObjectMapper mapper;

        JacksonSerializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public String serialize(WebCode code) throws SyntaxJsonException {
            try {
                return mapper.writeValueAsString(code);
            } catch (JsonProcessingException e) {
                throw new SyntaxJsonException("Failed to serialize code section", e);
            }
        }

        @Override
        public String serializePretty(WebCode code) throws SyntaxJsonException {
            try {
                return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(code);
            } catch (JsonProcessingException e) {
                throw new SyntaxJsonException("Failed to serialize code section", e);
            }
        }

        @Override
        public String serializeNode(SyntaxNode node) throws SyntaxJsonException {
            try {
                return mapper.writerFor(SyntaxNode.class).writeValueAsString(node);
            } catch (JsonProcessingException e) {
                throw new SyntaxJsonException("Failed to serialize " + node.type(), e);
            }
        }

        @Override
        public String serialize(PrettifiedCode code) throws SyntaxJsonException {
            try {
                return mapper.writeValueAsString(code);
            } catch (JsonProcessingException e) {
                throw new SyntaxJsonException("Failed to serialize layout result", e);
            }
        }
    }

    private static class JacksonDeserializer implements SyntaxJsonDeserializer {
        private static final TypeReference<List<Token>> TOKEN_LIST = new TypeReference<>() {
        };

        private final ObjectMapper mapper;

        JacksonDeserializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public List<Token> deserializeTokens(String json) throws SyntaxJsonException {
            try {
                return List.copyOf(mapper.readValue(json, TOKEN_LIST));
            } catch (JsonProcessingException | IllegalArgumentException e) {
                throw new SyntaxJsonException("Failed to deserialize token list", e);
            }
        }

        @Override
        public PrettifierConfig deserializeConfig(String json) throws SyntaxJsonException {
            JsonNode root;
            try {
                root = mapper.readTree(json);
            } catch (JsonProcessingException e) {
                throw new SyntaxJsonException("Failed to deserialize configuration", e);
            }
            if (root == null || !root.isObject()) {
                throw new SyntaxJsonException("Configuration must be a JSON object");
            }

            PrettifierConfig defaults = PrettifierConfig.defaults();
            int width = root.path("fullWidth").asInt(defaults.fullWidth());
            ScopeTable scopes = readScopes(root.path("scopes"), defaults.scopes());

            try {
                return new PrettifierConfig(width, scopes);
            } catch (IllegalArgumentException e) {
                throw new SyntaxJsonException("Invalid configuration: " + e.getMessage(), e);
            }
        }

        private static ScopeTable readScopes(JsonNode node, ScopeTable d) {
            if (!node.isObject()) {
                return d;
            }
            return new ScopeTable(
                scope(node, "initial", d.initial()),
                scope(node, "keyword", d.keyword()),
                scope(node, "comment", d.comment()),
                scope(node, "stringLiteral", d.stringLiteral()),
                scope(node, "hexLiteral", d.hexLiteral()),
                scope(node, "octalLiteral", d.octalLiteral()),
                scope(node, "decimalLiteral", d.decimalLiteral()),
                scope(node, "floatLiteral", d.floatLiteral()),
                scope(node, "labelName", d.labelName())
            );
        }

        private static Scope scope(JsonNode node, String key, Scope fallback) {
            JsonNode value = node.get(key);
            if (value == null || !value.isTextual()) {
                return fallback;
            }
            try {
                return new Scope(value.asText());
            } catch (IllegalArgumentException e) {
                throw new SyntaxJsonException("Invalid scope for '" + key + "'", e);
            }
        }
    }
}
