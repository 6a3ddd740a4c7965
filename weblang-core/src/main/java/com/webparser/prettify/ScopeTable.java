package com.webparser.prettify;

/**
 * The style scopes used by the prettifier. Built once, shared read-only.
 */
public record ScopeTable(
    Scope initial,
    Scope keyword,
    Scope comment,
    Scope stringLiteral,
    Scope hexLiteral,
    Scope octalLiteral,
    Scope decimalLiteral,
    Scope floatLiteral,
    Scope labelName
) {
    private static final ScopeTable DEFAULTS = new ScopeTable(
        new Scope("source.c"),
        new Scope("keyword.control.c"),
        new Scope("comment.line.c"),
        new Scope("string.quoted.double"),
        new Scope("constant.numeric.integer.hexadecimal"),
        new Scope("constant.numeric.integer.octal"),
        new Scope("constant.numeric.integer.decimal"),
        new Scope("constant.numeric.float"),
        new Scope("entity.name.label")
    );

    public static ScopeTable defaults() {
        return DEFAULTS;
    }
}
