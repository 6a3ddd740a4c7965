package com.webparser.ast;

import com.webparser.Token;
import com.webparser.prettify.RenderFlex;

/**
 * Pascal statements. Measuring and rendering a statement never includes its
 * trailing comment or semicolon; {@link StatementLayout} adds those.
 */
public sealed interface WebStatement extends SyntaxNode, RenderFlex permits
    Block,
    Assignment,
    Goto,
    If,
    While,
    For,
    Repeat,
    Loop,
    Label,
    Case,
    ExprStatement,
    ModuleReferenceStatement,
    PreprocessorDirective,
    FreeCase {

    /**
     * The comment trailing the statement, or null.
     */
    default Token comment() {
        return null;
    }

    /**
     * Whether the statement is followed by a semicolon inside a statement list.
     */
    default boolean wantsSemicolon() {
        return true;
    }
}
