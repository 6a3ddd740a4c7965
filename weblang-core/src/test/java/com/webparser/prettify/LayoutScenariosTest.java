package com.webparser.prettify;

import com.webparser.TokenFixtures;
import com.webparser.ast.StatementToplevel;
import com.webparser.ast.WebCode;
import com.webparser.ast.WebStatement;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.webparser.TokenFixtures.render;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * End-to-end layout of parsed sections.
 */
public class LayoutScenariosTest {

    private static final String[] SAMPLES = {
        "x := y + 1 ;",
        "const foo = 42 ;",
        "type t = array [ 1 .. 10 ] of integer ;",
        "result := alpha_value + beta_value + gamma_value + delta_value + epsilon_value ;",
        "if cur_length > max_length then begin overflow ( pool_size , init_pool_ptr ) ; goto done ; end ;",
        "while k < buf_size do begin buffer [ k ] := first_text_char ; incr ( k ) ; end ;",
        "case c of 1 : x := 1 ; 2 , 3 : y := 2 ; others~else z := 3 ; endcases~end ;",
        "procedure print_the_digs ( k : eight_bits ) ; begin while k > 0 do begin decr ( k ) ; end ; end ;",
        "@d print_ASCII_code == print_char ( xchr [ s ] ) ; print_ln",
        "for k := 0 to 255 do if ( k < 32 ) or ( k > 126 ) then xchr [ k ] := unprintable_char ;",
        "type half_range = min_halfword_value .. max_halfword_value_bound ;",
        "var trie_table : array [ min_trie_op_index .. max_trie_op_index_bound ] of quarterword ;",
    };

    private static void assertWithinWidth(String source, int width) {
        for (String line : render(source, width).split("\n")) {
            assertTrue(line.length() <= width, "line of " + line.length() + " > " + width + ": [" + line + "]");
        }
    }

    @Test
    void testWideExpressionBreaksAfterFirstOperand() {
        String source = "result := alpha_value + beta_value + gamma_value + delta_value + epsilon_value ;";

        assertEquals("result := alpha_value\n"
            + "  + beta_value + gamma_value + delta_value + epsilon_value", render(source));
    }

    @Test
    void testBinaryChainExplodes() {
        assertEquals("a_long_name\n  + b_long_name + c_long_name",
            render("a_long_name + b_long_name + c_long_name", 30));
        assertEquals("a_long_name\n  + b_long_name\n  + c_long_name + d_long_name",
            render("a_long_name + b_long_name + c_long_name + d_long_name", 30));
    }

    @Test
    void testLinesStayWithinWidth() {
        for (int width : new int[] {40, 60, 80}) {
            for (String source : SAMPLES) {
                for (String line : render(source, width).split("\n")) {
                    assertTrue(line.length() <= width, "line too long at width " + width + ": " + line);
                }
            }
        }
        System.out.println("✓ All sample lines fit their width");
    }

    @Test
    void testIndentReturnsToZero() {
        for (String source : SAMPLES) {
            WebCode code = TokenFixtures.parse(source);
            Prettifier dest = new Prettifier();
            code.prettify(dest);

            assertEquals(0, dest.indent(), source);
            assertEquals(0, dest.reservedTrailing(), source);
        }
    }

    @Test
    void testSemicolonKeptWithinWidth() {
        String rhs = "a".repeat(51);

        // Inline the statement would end exactly at column 60, leaving no room for ';'
        assertEquals("begin\n    x :=\n      " + rhs + ";\nend", render("begin x := " + rhs + " ; end ;"));
    }

    @Test
    void testStatementsEndingAtTheBudget() {
        for (int n = 30; n <= 51; n++) {
            String name = "a".repeat(n);
            assertWithinWidth("begin x := " + name + " ; end ;", 60);
            assertWithinWidth("begin print_it ( " + name + " ) ; end ;", 60);
            assertWithinWidth("begin x := y + " + name + " ; end ;", 60);
            assertWithinWidth("if c then x := " + name + " ;", 60);
        }
    }

    @Test
    void testDeclarationsEndingAtTheBudget() {
        for (int n = 10; n <= 40; n++) {
            String name = "b".repeat(n);
            assertWithinWidth("type t = first_bound_name .. " + name + " ;", 60);
            assertWithinWidth("var v : array [ 0 .. " + name + " ] of integer ;", 60);
            assertWithinWidth("type t = array [ first_bound_name .. " + name + " ] of integer ;", 60);
        }
    }

    @Test
    void testInlineMeasureMatchesRendering() {
        for (String source : new String[] {
            "x := y + 1 ;",
            "if a > b then x := 1 else x := 2 ;",
            "while not done do incr ( k ) ;",
            "for i := n downto 1 do x [ i ] := 0 ;",
            "goto done ;",
            "'a' , 'b' : x := 1 ;",
        }) {
            StatementToplevel tl = (StatementToplevel) TokenFixtures.parseOne(source);
            WebStatement stmt = tl.statement();
            Prettifier dest = new Prettifier(PrettifierConfig.defaults().withFullWidth(200));
            stmt.renderInline(dest);

            assertEquals(stmt.measureInline(), dest.finish().text().length(), source);
        }
    }

    @Test
    void testLongCallArgumentsGoOnTheirOwnLine() {
        String source = "print_err ( first_argument_name , second_argument_name , third_one ) ;";

        assertEquals("print_err(\n  first_argument_name, second_argument_name, third_one,\n)", render(source));
    }

    @Test
    void testStyledOutput() {
        PrettifiedCode code = TokenFixtures.parse("if x then goto done ;")
            .render(PrettifierConfig.defaults(), ModuleIdResolver.NONE);
        ScopeTable scopes = ScopeTable.defaults();

        assertEquals("if x then goto done", code.text());
        assertEquals(new StyledSpan(scopes.keyword(), "if"), code.spans(scopes).get(0));
        assertEquals(new StyledSpan(scopes.labelName(), "done"), code.spans(scopes).get(code.spans(scopes).size() - 1));
    }

    @Test
    void testCustomScopes() {
        ScopeTable defaults = ScopeTable.defaults();
        ScopeTable custom = new ScopeTable(
            defaults.initial(), new Scope("keyword.pascal"), defaults.comment(), defaults.stringLiteral(),
            defaults.hexLiteral(), defaults.octalLiteral(), defaults.decimalLiteral(),
            defaults.floatLiteral(), defaults.labelName());
        PrettifiedCode code = TokenFixtures.parse("goto done ;")
            .render(new PrettifierConfig(60, custom), ModuleIdResolver.NONE);

        assertEquals(new Scope("keyword.pascal"), code.ops().get(0).scope());
    }

    @Test
    void testModuleReferenceCrossReferences() {
        PrettifiedCode code = TokenFixtures.parse("var @<Global_variables@>")
            .render(PrettifierConfig.defaults(), ModuleIdResolver.of(Map.of("Global_variables", 13)));

        assertEquals("var <Global_variables>", code.text());
        assertEquals(new PositionedInsert(4, new TexInsert.ModuleReferenceStart(13)), code.inserts().get(0));
        assertEquals(new PositionedInsert(22, new TexInsert.MacroEnd()), code.inserts().get(1));
    }
}
