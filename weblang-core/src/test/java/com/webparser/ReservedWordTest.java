package com.webparser;

import com.webparser.ast.BuiltinType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static com.webparser.TokenFixtures.render;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

/**
 * Keyword spelling must not follow the default locale: Turkish maps 'I' to a dotless 'ı'.
 */
public class ReservedWordTest {

    private Locale saved;

    @BeforeEach
    void useTurkishLocale() {
        saved = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
    }

    @AfterEach
    void restoreLocale() {
        Locale.setDefault(saved);
    }

    @Test
    void testPascalNamesIgnoreLocale() {
        assertEquals("if", ReservedWord.IF.pascalName());
        assertEquals("in", ReservedWord.IN.pascalName());
        assertEquals("if", Token.reserved(ReservedWord.IF).displayText());
        assertEquals("integer", BuiltinType.Kind.INTEGER.pascalName());
    }

    @Test
    void testLookupIgnoresLocale() {
        assertEquals(ReservedWord.IF, ReservedWord.lookup("IF"));
        assertEquals(ReservedWord.PROCEDURE, ReservedWord.lookup("PROCEDURE"));
        assertEquals(BuiltinType.Kind.INTEGER, BuiltinType.Kind.lookup("integer"));
        assertNull(ReservedWord.lookup("ıf"));
    }

    @Test
    void testRenderingUnderTurkishLocale() {
        assertEquals("if a then x := 1", render("if a then x := 1 ;"));
        assertEquals("var i: integer;", render("var i : integer ;"));
    }
}
