package com.webparser.prettify;

/**
 * Zero-width markup spliced into the output at an exact text offset.
 */
public sealed interface TexInsert {

    /** Start of a macro wrapping a module reference; closed by {@link MacroEnd}. */
    record ModuleReferenceStart(int moduleId) implements TexInsert {
    }

    /** Closing brace of a macro. */
    record MacroEnd() implements TexInsert {
    }

    /**
     * Placed at offset zero when the array-table macro idiom is in use, so the
     * emitter switches to its special delimiters.
     */
    record ArrayMacroMarker() implements TexInsert {
    }

    /** An unescaped {@code ]} that must land outside any style group. */
    record ArrayMacroBracket() implements TexInsert {
    }
}
