package com.webparser;

public enum ParseErrorKind {
    /** End of expected input; the usual "try the next alternative" signal. */
    EOF,
    EXPECTED_PASCAL_TOKEN,
    EXPECTED_RESERVED_WORD,
    EXPECTED_IDENTIFIER,
    EXPECTED_LITERAL,
    EXPECTED_DELIMITER,
    EXPECTED_COMMENT,
    EXPECTED_MODULE_REFERENCE,
    EXPECTED_END_OF_DEFINE,
    /** A production matched but was rejected by a side condition. */
    REJECTED,
    /** No toplevel alternative matched while tokens remain. */
    NO_ALTERNATIVE
}
