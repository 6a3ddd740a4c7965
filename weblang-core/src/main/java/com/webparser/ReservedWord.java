package com.webparser;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Pascal reserved words as used by WEB programs.
 *
 * <p>{@link #XCLAUSE} is not a Pascal word: it is the tag the WEB macro layer
 * gives to identifiers such as {@code loop} that introduce a looping construct.</p>
 */
public enum ReservedWord {
    AND,
    ARRAY,
    BEGIN,
    CASE,
    CONST,
    DIV,
    DO,
    DOWNTO,
    ELSE,
    END,
    FILE,
    FOR,
    FORWARD,
    FUNCTION,
    GOTO,
    IF,
    IN,
    LABEL,
    MOD,
    NIL,
    NOT,
    OF,
    OR,
    PACKED,
    PROCEDURE,
    PROGRAM,
    RECORD,
    REPEAT,
    THEN,
    TO,
    TYPE,
    UNTIL,
    VAR,
    WHILE,
    WITH,
    XCLAUSE;

    private static final Map<String, ReservedWord> BY_NAME = new HashMap<>();

    static {
        for (ReservedWord word : values()) {
            if (word != XCLAUSE) {
                BY_NAME.put(word.pascalName(), word);
            }
        }
    }

    /**
     * The word as it is spelled in Pascal source.
     */
    public String pascalName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Looks up a reserved word by its Pascal spelling (case-insensitive).
     *
     * @return the word, or null if {@code text} is not reserved
     */
    public static ReservedWord lookup(String text) {
        return BY_NAME.get(text.toLowerCase(Locale.ROOT));
    }
}
