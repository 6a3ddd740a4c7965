package com.webparser;

import org.junit.jupiter.api.Test;

import java.util.List;

import static com.webparser.TokenFixtures.cursor;
import static com.webparser.TokenFixtures.lex;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class CombinatorsTest {

    @Test
    void testCursorSkipsFormattingMarkers() {
        TokenCursor c = cursor("~fmt x ~eol ~fmt y");

        assertEquals("x", c.peek().text());
        assertEquals("y", c.advance().peek().text());
        assertTrue(c.advance().advance().isAtEnd());
    }

    @Test
    void testPeekAtEndThrowsEof() {
        TokenCursor c = cursor("~fmt");

        assertTrue(c.isAtEnd());
        ExpectedTokenException e = assertThrows(ExpectedTokenException.class, c::peek);
        assertEquals(ParseErrorKind.EOF, e.kind());
    }

    @Test
    void testAltTakesFirstSuccess() {
        Parsed<Token> p = Combinators.<Token>alt(cursor("x"),
            Combinators.token(TokenType.INT_LITERAL),
            Combinators.token(TokenType.IDENTIFIER),
            Combinators::anyToken);

        assertEquals(TokenType.IDENTIFIER, p.value().type());
        assertTrue(p.rest().isAtEnd());
    }

    @Test
    void testOptLeavesCursorUnchanged() {
        TokenCursor c = cursor("x");
        Parsed<Token> p = Combinators.opt(c, Combinators::comment);

        assertNull(p.value());
        assertEquals(c.position(), p.rest().position());
    }

    @Test
    void testSeparatedListLeavesDanglingSeparator() {
        Parsed<List<Token>> p = Combinators.separatedList1(cursor("a , b , ;"), TokenType.COMMA, Combinators::identifier);

        assertEquals(2, p.value().size());
        assertEquals(TokenType.COMMA, p.rest().peek().type());
    }

    @Test
    void testSeparatedList0AcceptsNothing() {
        Parsed<List<Token>> p = Combinators.separatedList0(cursor(")"), TokenType.COMMA, Combinators::identifier);

        assertTrue(p.value().isEmpty());
        assertEquals(0, p.rest().position());
    }

    @Test
    void testMany1RequiresOne() {
        assertThrows(ExpectedTokenException.class,
            () -> Combinators.many1(cursor("1"), Combinators::identifier));
        assertEquals(3, Combinators.many1(cursor("a b c 1"), Combinators::identifier).value().size());
    }

    @Test
    void testMergedStringLiterals() {
        Parsed<Token> p = Combinators.mergedStringLiterals(cursor("'ab' 'cd' x"));

        assertEquals("\"ab\"\"cd\"", p.value().text());
        assertEquals(0, p.value().start());
        assertEquals(9, p.value().end());
        assertEquals("x", p.rest().peek().text());
    }

    @Test
    void testSingleStringIsUnchanged() {
        List<Token> tokens = lex("'ab'");
        Parsed<Token> p = Combinators.mergedStringLiterals(TokenCursor.start(tokens));

        assertEquals(tokens.get(0), p.value());
    }

    @Test
    void testPeekEndOfDefine() {
        assertTrue(Combinators.peekEndOfDefine(cursor("")).rest().isAtEnd());
        assertEquals(0, Combinators.peekEndOfDefine(cursor("@d x == 1")).rest().position());
        assertEquals(0, Combinators.peekEndOfDefine(cursor("@f x == y")).rest().position());
        assertThrows(ExpectedTokenException.class, () -> Combinators.peekEndOfDefine(cursor("x")));
    }

    @Test
    void testFormattedIdentifierIsNotReservedWord() {
        TokenCursor c = cursor("loop~begin");

        assertThrows(ExpectedTokenException.class, () -> Combinators.reservedWord(c, ReservedWord.BEGIN));
        assertEquals("loop", Combinators.formattedIdentifierLike(c, ReservedWord.BEGIN).value().text());
        assertEquals("loop", Combinators.wordOrFormattedLike(c, ReservedWord.BEGIN).value().text());
    }

    @Test
    void testSkipSemicolon() {
        assertEquals(1, Combinators.skipSemicolon(cursor("; x")).position());
        assertEquals(0, Combinators.skipSemicolon(cursor("x ;")).position());
        assertTrue(Combinators.skipSemicolon(cursor("")).isAtEnd());
    }

    @Test
    void testTokenNormalization() {
        Token reserved = new Token(TokenType.RESERVED_WORD, "Begin");
        Token bracket = new Token(TokenType.OPEN_DELIMITER, "@{");

        assertEquals(ReservedWord.BEGIN, reserved.word());
        assertEquals("begin", reserved.displayText());
        assertEquals(DelimiterKind.META_COMMENT, bracket.delimiter());
        assertEquals("", new Token(TokenType.IDENTIFIER, null).text());
        assertThrows(IllegalArgumentException.class, () -> new Token(null, "x"));
    }

    @Test
    void testIntLiteralDisplay() {
        assertEquals("0xFF", lex("0xFF").get(0).displayText());
        assertEquals("0o17", lex("0o17").get(0).displayText());
        assertEquals("42", lex("42").get(0).displayText());
    }
}
