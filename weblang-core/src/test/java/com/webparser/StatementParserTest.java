package com.webparser;

import com.webparser.ast.Assignment;
import com.webparser.ast.Block;
import com.webparser.ast.Case;
import com.webparser.ast.CaseItem;
import com.webparser.ast.ExprStatement;
import com.webparser.ast.For;
import com.webparser.ast.FreeCase;
import com.webparser.ast.Goto;
import com.webparser.ast.If;
import com.webparser.ast.Label;
import com.webparser.ast.Loop;
import com.webparser.ast.ModuleReferenceStatement;
import com.webparser.ast.PreprocessorDirective;
import com.webparser.ast.Repeat;
import com.webparser.ast.WebStatement;
import com.webparser.ast.While;
import org.junit.jupiter.api.Test;

import static com.webparser.TokenFixtures.cursor;
import static com.webparser.TokenFixtures.render;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class StatementParserTest {

    private static WebStatement statement(String source) {
        Parsed<WebStatement> p = StatementParser.parseStatement(cursor(source));
        assertTrue(p.rest().isAtEnd(), "unconsumed input in " + source);
        return p.value();
    }

    @Test
    void testAssignment() {
        Assignment a = assertInstanceOf(Assignment.class, statement("x := y + 1 ;"));

        assertNull(a.comment());
        assertEquals("x := y + 1", render("x := y + 1 ;"));
    }

    @Test
    void testAssignmentWithComment() {
        Assignment a = assertInstanceOf(Assignment.class, statement("x := 1 ; {set_x}"));

        assertNotNull(a.comment());
        assertEquals("x := 1 /* set_x */", render("x := 1 ; {set_x}"));
    }

    @Test
    void testIfElse() {
        If s = assertInstanceOf(If.class, statement("if a > b then x := 1 else x := 2 ;"));

        assertNotNull(s.otherwise());
        assertEquals(32, s.measureInline());
        assertEquals("if a > b then x := 1 else x := 2", render("if a > b then x := 1 else x := 2 ;"));
    }

    @Test
    void testIfWithBlock() {
        assertEquals("if a then begin\n    x := 1;\nend", render("if a then begin x := 1 end"));
    }

    @Test
    void testBlockWithLabel() {
        Block b = assertInstanceOf(Block.class, statement("begin x := 1 ; done : y := 2 end"));

        assertEquals(3, b.statements().size());
        assertInstanceOf(Label.class, b.statements().get(1));
        assertEquals("begin\n    x := 1;\n    done:\n    y := 2;\nend", render("begin x := 1 ; done : y := 2 end"));
    }

    @Test
    void testEmptyBlockStaysInline() {
        assertEquals("begin end", render("begin end"));
    }

    @Test
    void testFormattedBlockKeywords() {
        Block b = assertInstanceOf(Block.class, statement("init~begin x := 1 ; tini~end"));

        assertEquals("init", b.opener().text());
        assertEquals("init\n    x := 1;\ntini", render("init~begin x := 1 ; tini~end"));
    }

    @Test
    void testWhile() {
        assertInstanceOf(While.class, statement("while a do x := 1 ;"));
        assertEquals("while a do x := 1", render("while a do x := 1 ;"));
    }

    @Test
    void testForBothDirections() {
        For up = assertInstanceOf(For.class, statement("for i := 1 to n do x := i ;"));
        For down = assertInstanceOf(For.class, statement("for i := n downto 1 do x := i ;"));

        assertEquals(ReservedWord.TO, up.direction().word());
        assertEquals(ReservedWord.DOWNTO, down.direction().word());
        assertEquals(25, up.measureInline());
        assertEquals("for i := 1 to n do x := i", render("for i := 1 to n do x := i ;"));
    }

    @Test
    void testRepeat() {
        Repeat r = assertInstanceOf(Repeat.class, statement("repeat x := x + 1 ; until x > 10 ;"));

        assertEquals(1, r.statements().size());
        assertEquals("repeat\n    x := x + 1;\nuntil x > 10", render("repeat x := x + 1 ; until x > 10 ;"));
    }

    @Test
    void testGoto() {
        assertInstanceOf(Goto.class, statement("goto done ;"));
        assertEquals("goto done", render("goto done ;"));
    }

    @Test
    void testLoop() {
        Loop l = assertInstanceOf(Loop.class, statement("loop~xclause begin x := 1 end"));

        assertInstanceOf(Block.class, l.body());
        assertEquals("loop begin\n    x := 1;\nend", render("loop~xclause begin x := 1 end"));
    }

    @Test
    void testCase() {
        String source = "case c of 1 : x := 1 ; 2 , 3 : y := 2 ; others~else z := 3 ; endcases~end ;";
        Case c = assertInstanceOf(Case.class, statement(source));

        assertEquals(3, c.items().size());
        assertEquals(2, ((CaseItem.Standard) c.items().get(1)).matches().size());
        assertInstanceOf(CaseItem.OtherCases.class, c.items().get(2));
        assertEquals("case c of\n    1: x := 1;\n    2, 3: y := 2;\n    others z := 3;\nendcases", render(source));
    }

    @Test
    void testCaseWithModuleReferenceArm() {
        Case c = assertInstanceOf(Case.class, statement("case c of @<Cases_for_x@> 1 : goto done ; endcases~end"));

        assertInstanceOf(CaseItem.ModuleReference.class, c.items().get(0));
        assertInstanceOf(CaseItem.Standard.class, c.items().get(1));
    }

    @Test
    void testFreeCase() {
        FreeCase f = assertInstanceOf(FreeCase.class, statement("'a' , 'b' : x := 1 ;"));

        assertEquals(2, f.matches().size());
        assertEquals("\"a\", \"b\": x := 1", render("'a' , 'b' : x := 1 ;"));
    }

    @Test
    void testPreprocessorDirective() {
        assertInstanceOf(PreprocessorDirective.class, statement("@{ $C-,A+,D- @}"));
        assertEquals("{$C-,A+,D-}", render("@{ $C-,A+,D- @}"));
    }

    @Test
    void testModuleReferenceStatement() {
        ModuleReferenceStatement m = assertInstanceOf(ModuleReferenceStatement.class, statement("@<Do_it@> ;"));

        assertEquals("Do_it", m.module().text());
        assertEquals("<Do_it>", render("@<Do_it@> ;"));
    }

    @Test
    void testExpressionStatement() {
        assertInstanceOf(ExprStatement.class, statement("print_ln ( s ) ;"));
        assertEquals("print_ln(s)", render("print_ln ( s ) ;"));
    }
}
