package com.webparser;

/**
 * Kinds of tokens produced by the external WEB lexer.
 */
public enum TokenType {
    IDENTIFIER,
    FORMATTED_IDENTIFIER,   // identifier tagged to behave like a reserved word
    RESERVED_WORD,
    INT_LITERAL,            // 42, "FF (hex), '777 (octal)
    STRING_LITERAL,
    HASH,                   // '#', a macro parameter
    STRING_POOL_CHECKSUM,   // '@$'

    PLUS,
    MINUS,
    TIMES,
    DIVIDE,
    GREATER,
    GREATER_EQUALS,
    LESS,
    LESS_EQUALS,
    EQUALS,
    NOT_EQUALS,
    GETS,                   // ':='
    EQUIVALENCE,            // '=='
    DOUBLE_DOT,
    PERIOD,
    COMMA,
    COLON,
    SEMICOLON,
    CARET,

    OPEN_DELIMITER,
    CLOSE_DELIMITER,

    COMMENT,
    MODULE_REFERENCE,
    DEFINE,                 // '@d'
    FORMAT,                 // '@f'
    COMPILER_DIRECTIVE,     // e.g. '$C-,A+,D-' inside a meta-comment

    // Formatting markers. These carry no Pascal meaning and are skipped by the cursor.
    FORMATTING,
    FORCED_EOL,
    TEX_STRING;

    public boolean isFormattingMarker() {
        return this == FORMATTING || this == FORCED_EOL || this == TEX_STRING;
    }
}
