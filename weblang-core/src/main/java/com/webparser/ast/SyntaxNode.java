package com.webparser.ast;

/**
 * Base interface for all WEB Pascal syntax tree nodes.
 */
public sealed interface SyntaxNode permits
    WebToplevel,
    WebStatement,
    WebExpr,
    WebType,
    IndexTerm,
    RangeBound,
    ListLiteralTerm,
    CaseItem,
    RecordField,
    ParameterGroup,
    FunctionHeader {

    default String type() {
        return getClass().getSimpleName();
    }
}
