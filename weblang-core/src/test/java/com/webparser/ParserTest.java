package com.webparser;

import com.webparser.ast.Assignment;
import com.webparser.ast.BinaryExpr;
import com.webparser.ast.ConstDeclaration;
import com.webparser.ast.Empty;
import com.webparser.ast.Standalone;
import com.webparser.ast.StatementToplevel;
import com.webparser.ast.WebCode;
import com.webparser.ast.WebToplevel;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.webparser.TokenFixtures.lex;
import static com.webparser.TokenFixtures.parse;
import static com.webparser.TokenFixtures.render;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ParserTest {

    @Test
    void testEmptyInput() {
        WebCode code = new Parser().parse(List.of());

        assertEquals(List.of(new Empty()), code.toplevels());
        assertEquals("/*nothing*/", render(""));
        System.out.println("✓ Empty input renders as /*nothing*/");
    }

    @Test
    void testOnlyFormattingMarkers() {
        WebCode code = parse("~fmt ~eol ~fmt");

        assertEquals(1, code.toplevels().size());
        assertInstanceOf(Empty.class, code.toplevels().get(0));
    }

    @Test
    void testSimpleAssignment() {
        StatementToplevel s = assertInstanceOf(StatementToplevel.class, TokenFixtures.parseOne("x := y + 1 ;"));
        Assignment a = assertInstanceOf(Assignment.class, s.statement());

        assertInstanceOf(BinaryExpr.class, a.rhs());
        assertEquals("x := y + 1", render("x := y + 1 ;"));
    }

    @Test
    void testConstDeclaration() {
        ConstDeclaration c = assertInstanceOf(ConstDeclaration.class, TokenFixtures.parseOne("const foo = 42 ;"));

        assertEquals("foo", c.name().text());
        assertEquals("42", c.value().text());
        assertEquals("const foo = 42;", render("const foo = 42 ;"));
    }

    @Test
    void testSeveralToplevels() {
        List<WebToplevel> toplevels = parse("x := 1 ; y := 2 ;").toplevels();

        assertEquals(2, toplevels.size());
        assertEquals("x := 1\ny := 2", render("x := 1 ; y := 2 ;"));
    }

    @Test
    void testUnclaimedTokenIsStandalone() {
        Standalone s = assertInstanceOf(Standalone.class, TokenFixtures.parseOne(") {why}"));

        assertNotNull(s.comment());
        assertEquals(") /* why */", render(") {why}"));
    }

    @Test
    void testEveryTokenSequenceParses() {
        String[] sources = {
            ") ) ( ] [",
            "then else of do",
            ":= := ..",
            "if x then",
            "begin x := 1",
            "case c of 1 : x := 1 ;",
            "@d @f ==",
            "record a : integer ;",
            "procedure ( ;",
        };

        for (String source : sources) {
            WebCode code = parse(source);
            assertTrue(code.toplevels().size() > 0, source);
            assertNotNull(render(source), source);
        }
    }

    @Test
    void testTryParse() {
        assertTrue(new Parser().tryParse(lex("x := 1 ;")).isPresent());
    }

    @Test
    void testParseExceptionMessage() {
        List<Token> context = lex("x := 1");
        ParseException e = new ParseException(ParseErrorKind.NO_ALTERNATIVE, 4, context);

        assertEquals(ParseErrorKind.NO_ALTERNATIVE, e.kind());
        assertEquals(4, e.position());
        assertEquals(3, e.context().size());
        assertTrue(e.getMessage().contains("at token 4"));
        assertTrue(e.getMessage().contains("IDENTIFIER(x)"));
    }

    @Test
    void testParseIsRepeatable() {
        List<Token> tokens = lex("@d incr ( # ) == # := # + 1");
        Parser parser = new Parser();

        assertEquals(parser.parse(tokens), parser.parse(tokens));
    }
}
