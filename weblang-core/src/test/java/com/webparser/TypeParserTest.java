package com.webparser;

import com.webparser.ast.ArrayType;
import com.webparser.ast.BuiltinType;
import com.webparser.ast.PackedFileOfType;
import com.webparser.ast.PointerType;
import com.webparser.ast.RangeBound;
import com.webparser.ast.RangeType;
import com.webparser.ast.RecordType;
import com.webparser.ast.UserDefinedType;
import com.webparser.ast.WebType;
import com.webparser.prettify.Prettifier;
import com.webparser.prettify.PrettifierConfig;
import org.junit.jupiter.api.Test;

import static com.webparser.TokenFixtures.cursor;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TypeParserTest {

    private static WebType type(String source) {
        Parsed<WebType> p = TypeParser.parseType(cursor(source));
        assertTrue(p.rest().isAtEnd(), "unconsumed input in " + source);
        return p.value();
    }

    private static String flex(WebType t, int width) {
        Prettifier dest = new Prettifier(PrettifierConfig.defaults().withFullWidth(width));
        t.renderFlex(dest);
        return dest.finish().text();
    }

    @Test
    void testArrayOfRange() {
        ArrayType t = assertInstanceOf(ArrayType.class, type("array [ 1 .. 10 ] of integer"));

        assertFalse(t.packed());
        RangeType axis = assertInstanceOf(RangeType.class, t.axes().get(0));
        assertInstanceOf(RangeBound.Literal.class, axis.from());
        assertInstanceOf(BuiltinType.class, t.element());
        assertEquals("array [1 .. 10] of integer", flex(t, 60));
    }

    @Test
    void testPackedArrayWithSeveralAxes() {
        WebType t = type("packed array [ 0 .. max_x , 'a' .. 'z' ] of two_halves");

        assertEquals("packed array [0 .. max_x, \"a\" .. \"z\"] of two_halves", flex(t, 60));
    }

    @Test
    void testRangeBounds() {
        RangeType offsets = assertInstanceOf(RangeType.class, type("mem_bot + 1 .. mem_top - 2"));
        assertInstanceOf(RangeBound.SymbolicOffset.class, offsets.from());
        assertEquals("(mem_bot + 1) .. (mem_top - 2)", flex(offsets, 60));

        RangeType unary = assertInstanceOf(RangeType.class, type("- x .. x"));
        assertInstanceOf(RangeBound.UnarySymbolic.class, unary.from());
        assertInstanceOf(RangeBound.Symbolic.class, unary.to());
        assertEquals("-x .. x", flex(unary, 60));
    }

    @Test
    void testSimpleTypes() {
        assertEquals(BuiltinType.Kind.BOOLEAN, assertInstanceOf(BuiltinType.class, type("boolean")).kind());
        assertInstanceOf(UserDefinedType.class, type("real_number"));
        assertInstanceOf(PackedFileOfType.class, type("packed file of text_char"));

        PointerType p = assertInstanceOf(PointerType.class, type("^ node"));
        assertEquals("^node", flex(p, 60));
    }

    @Test
    void testRecord() {
        RecordType t = assertInstanceOf(RecordType.class, type("packed record a , b : integer ; c : ^ node ; {link} end"));

        assertTrue(t.packed());
        assertEquals(2, t.fields().size());
        assertNull(t.fields().get(0).comment());
        assertNotNull(t.fields().get(1).comment());
        assertEquals(Prettifier.NOT_INLINE, t.measureInline());
        assertEquals("packed record {\n    a, b: integer,\n    c: ^node, /* link */\n}", flex(t, 60));
    }

    @Test
    void testRecordNeedsFields() {
        assertThrows(ExpectedTokenException.class, () -> TypeParser.parseType(cursor("record end")));
    }

    @Test
    void testArrayElementOnNextLine() {
        WebType t = type("array [ 0 .. some_long_bound ] of memory_word");

        assertEquals("array [0 .. some_long_bound] of\n  memory_word", flex(t, 32));
    }

    @Test
    void testArrayAxesOnOwnLines() {
        WebType t = type("array [ 0 .. some_long_bound ] of memory_word");

        assertEquals("array [\n  0 .. some_long_bound,\n] of memory_word", flex(t, 26));
    }

    @Test
    void testLongRangeBreaksBeforeDots() {
        WebType t = type("first_really_long_bound_name .. second_really_long_bound_name");

        assertEquals("first_really_long_bound_name .. second_really_long_bound_name", flex(t, 61));
        assertEquals("first_really_long_bound_name\n  .. second_really_long_bound_name", flex(t, 60));
    }

    @Test
    void testLongRangeAxisBreaks() {
        WebType t = type("array [ first_really_long_bound_name .. second_really_long_bound_name ] of integer");

        assertEquals("array [\n"
            + "  first_really_long_bound_name\n"
            + "    .. second_really_long_bound_name,\n"
            + "] of integer", flex(t, 60));
    }
}
