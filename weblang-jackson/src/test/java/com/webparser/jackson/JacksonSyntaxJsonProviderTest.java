package com.webparser.jackson;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.webparser.Parser;
import com.webparser.ReservedWord;
import com.webparser.Token;
import com.webparser.TokenType;
import com.webparser.ast.Assignment;
import com.webparser.ast.StatementToplevel;
import com.webparser.ast.WebCode;
import com.webparser.json.SyntaxJsonException;
import com.webparser.json.SyntaxJsonProvider;
import com.webparser.prettify.ModuleIdResolver;
import com.webparser.prettify.PrettifiedCode;
import com.webparser.prettify.PrettifierConfig;
import com.webparser.prettify.ScopeTable;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class JacksonSyntaxJsonProviderTest {

    private final JacksonSyntaxJsonProvider provider = new JacksonSyntaxJsonProvider();
    private final ObjectMapper mapper = new ObjectMapper();

    private static String resource(String path) throws IOException {
        try (InputStream in = JacksonSyntaxJsonProviderTest.class.getResourceAsStream(path)) {
            assertNotNull(in, "missing test resource " + path);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private WebCode parseFixture() throws IOException {
        List<Token> tokens = provider.getDeserializer().deserializeTokens(resource("/tokens/assignment.json"));
        return new Parser().parse(tokens);
    }

    // ==================== Discovery ====================

    @Test
    void testServiceLoaderFindsJackson() {
        assertTrue(SyntaxJsonProvider.isProviderAvailable());
        assertInstanceOf(JacksonSyntaxJsonProvider.class, SyntaxJsonProvider.getProvider());
        assertEquals("Jackson", SyntaxJsonProvider.getProvider("jackson").getName());
        assertEquals(1, SyntaxJsonProvider.providers().size());
    }

    @Test
    void testUnknownProviderNamesTheAvailableOnes() {
        IllegalStateException e = assertThrows(IllegalStateException.class,
            () -> SyntaxJsonProvider.getProvider("gson"));

        assertTrue(e.getMessage().contains("gson"));
        assertTrue(e.getMessage().contains("Jackson"));
    }

    // ==================== Pipeline ====================

    @Test
    void testParseTokens() throws IOException {
        WebCode code = provider.parseTokens(resource("/tokens/assignment.json"));

        assertInstanceOf(StatementToplevel.class, code.toplevels().get(0));
    }

    @Test
    void testRenderWithDefaultConfig() throws IOException {
        PrettifiedCode rendered = provider.render(resource("/tokens/assignment.json"), null, ModuleIdResolver.NONE);

        assertEquals("x := y + 1", rendered.text());
    }

    @Test
    void testPrettifyTokensToJson() throws IOException {
        String json = provider.prettify(
            resource("/tokens/assignment.json"), resource("/tokens/config.json"), ModuleIdResolver.NONE);
        JsonNode root = mapper.readTree(json);

        assertEquals("x := y + 1", root.path("text").asText());
        assertTrue(root.path("ops").size() > 0);
    }

    @Test
    void testPrettifyRejectsBadConfig() throws IOException {
        String tokens = resource("/tokens/assignment.json");

        assertThrows(SyntaxJsonException.class,
            () -> provider.prettify(tokens, "{\"fullWidth\":2}", ModuleIdResolver.NONE));
    }

    // ==================== Tokens ====================

    @Test
    void testDeserializeTokens() throws IOException {
        List<Token> tokens = provider.getDeserializer().deserializeTokens(resource("/tokens/assignment.json"));

        assertEquals(6, tokens.size());
        assertEquals(TokenType.GETS, tokens.get(1).type());
        assertEquals(":=", tokens.get(1).text());
        assertEquals(2, tokens.get(1).start());
        assertEquals(4, tokens.get(1).end());
        assertEquals(TokenType.FORMATTING, tokens.get(3).type());
    }

    @Test
    void testReservedWordInferredFromText() {
        List<Token> tokens = provider.getDeserializer().deserializeTokens(
            "[{\"type\":\"RESERVED_WORD\",\"text\":\"begin\"},{\"type\":\"OPEN_DELIMITER\",\"text\":\"(\"}]");

        assertEquals(ReservedWord.BEGIN, tokens.get(0).word());
        assertNotNull(tokens.get(1).delimiter());
    }

    @Test
    void testParsedFixtureIsAssignment() throws IOException {
        WebCode code = parseFixture();

        assertEquals(1, code.toplevels().size());
        StatementToplevel top = assertInstanceOf(StatementToplevel.class, code.toplevels().get(0));
        assertInstanceOf(Assignment.class, top.statement());
        assertEquals("x := y + 1", code.render(PrettifierConfig.defaults(), ModuleIdResolver.NONE).text());
    }

    @Test
    void testBadTokenJson() {
        var deserializer = provider.getDeserializer();
        assertThrows(SyntaxJsonException.class, () -> deserializer.deserializeTokens("[{\"type\":"));
        assertThrows(SyntaxJsonException.class, () -> deserializer.deserializeTokens("[{\"type\":\"NOPE\"}]"));
        assertThrows(SyntaxJsonException.class, () -> deserializer.deserializeTokens("[{\"text\":\"x\"}]"));
    }

    // ==================== Tree ====================

    @Test
    void testSerializeTree() throws IOException {
        String json = provider.getSerializer().serialize(parseFixture());
        JsonNode root = mapper.readTree(json);

        JsonNode top = root.path("toplevels").get(0);
        assertEquals("StatementToplevel", top.path("type").asText());
        assertEquals("Assignment", top.path("statement").path("type").asText());
        JsonNode rhs = top.path("statement").path("rhs");
        assertEquals("BinaryExpr", rhs.path("type").asText());
        assertEquals("+", rhs.path("op").path("text").asText());
        assertEquals("TokenExpr", rhs.path("lhs").path("type").asText());
        assertFalse(top.has("comment"), "absent comment is omitted");

        System.out.println("✓ " + json);
    }

    @Test
    void testSerializeNode() throws IOException {
        StatementToplevel top = (StatementToplevel) parseFixture().toplevels().get(0);
        JsonNode node = mapper.readTree(provider.getSerializer().serializeNode(top.statement()));

        assertEquals("Assignment", node.path("type").asText());
        assertEquals("x", node.path("lhs").path("token").path("text").asText());
    }

    @Test
    void testSerializePrettyIsSameTree() throws IOException {
        WebCode code = parseFixture();
        String compact = provider.getSerializer().serialize(code);
        String pretty = provider.getSerializer().serializePretty(code);

        assertTrue(pretty.contains("\n"));
        assertEquals(mapper.readTree(compact), mapper.readTree(pretty));
    }

    // ==================== Layout ====================

    @Test
    void testSerializePrettifiedCode() throws IOException {
        PrettifiedCode rendered = parseFixture().render(PrettifierConfig.defaults(), ModuleIdResolver.NONE);
        JsonNode root = mapper.readTree(provider.getSerializer().serialize(rendered));

        assertEquals("x := y + 1", root.path("text").asText());
        assertTrue(root.path("inserts").isArray());

        boolean sawDecimal = false;
        for (JsonNode op : root.path("ops")) {
            if (op.path("kind").asText().equals("PUSH")) {
                assertTrue(op.path("scope").isTextual(), "scopes are written as plain names");
                sawDecimal |= op.path("scope").asText().equals("constant.numeric.integer.decimal");
            } else {
                assertFalse(op.has("scope"));
            }
        }
        assertTrue(sawDecimal);
    }

    @Test
    void testSerializeModuleReferenceInsert() throws IOException {
        List<Token> tokens = provider.getDeserializer().deserializeTokens(
            "[{\"type\":\"MODULE_REFERENCE\",\"text\":\"Print the table\"}]");
        PrettifiedCode rendered = new Parser().parse(tokens)
            .render(PrettifierConfig.defaults(), ModuleIdResolver.of(Map.of("Print the table", 12)));

        JsonNode inserts = mapper.readTree(provider.getSerializer().serialize(rendered)).path("inserts");
        assertEquals(2, inserts.size());
        assertEquals(12, inserts.get(0).path("insert").path("moduleId").asInt());
        assertTrue(inserts.get(1).path("insert").path("type").asText().endsWith("MacroEnd"));
    }

    // ==================== Config ====================

    @Test
    void testDeserializeConfig() throws IOException {
        PrettifierConfig config = provider.getDeserializer().deserializeConfig(resource("/tokens/config.json"));

        assertEquals(72, config.fullWidth());
        assertEquals("keyword.pascal", config.scopes().keyword().name());
        assertEquals(ScopeTable.defaults().comment(), config.scopes().comment());
    }

    @Test
    void testEmptyConfigIsDefaults() {
        assertEquals(PrettifierConfig.defaults(), provider.getDeserializer().deserializeConfig("{}"));
    }

    @Test
    void testBadConfig() {
        var deserializer = provider.getDeserializer();
        assertThrows(SyntaxJsonException.class, () -> deserializer.deserializeConfig("{\"fullWidth\":3}"));
        assertThrows(SyntaxJsonException.class, () -> deserializer.deserializeConfig("[1, 2]"));
        assertThrows(SyntaxJsonException.class, () -> deserializer.deserializeConfig("{\"fullWidth\":"));
        assertThrows(SyntaxJsonException.class,
            () -> deserializer.deserializeConfig("{\"scopes\":{\"comment\":\"  \"}}"));
    }
}
