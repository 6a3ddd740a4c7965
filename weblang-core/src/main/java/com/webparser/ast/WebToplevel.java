package com.webparser.ast;

import com.webparser.prettify.Prettifier;

/**
 * One element of the toplevel sequence of a WEB code section.
 */
public sealed interface WebToplevel extends SyntaxNode permits
    Define,
    Format,
    Standalone,
    ProgramDefinition,
    LabelDeclaration,
    ModulifiedDeclaration,
    FunctionDefinition,
    ConstDeclaration,
    VarDeclaration,
    TypeDeclaration,
    ForwardDeclaration,
    StatementToplevel,
    Empty,
    SpecialIfdefForward,
    SpecialIfdefFunction,
    SpecialIfdefVarDeclaration,
    SpecialParenTwoIdent,
    SpecialEmptyBrackets,
    SpecialRelationalExpr,
    SpecialRange,
    SpecialCommentedOut,
    SpecialArrayMacro,
    SpecialListLiteralAssignment,
    SpecialListLiteral,
    SpecialIdentInListLiteral,
    SpecialInlineDefine,
    SpecialCommaExprs,
    SpecialFloatEquality,
    SpecialCoeffArray,
    SpecialImbalancedEnd,
    SpecialExprPeriod {

    /**
     * Lay out this toplevel starting at the current position. No trailing
     * newline is requested; the caller separates toplevels.
     */
    void prettify(Prettifier dest);
}
