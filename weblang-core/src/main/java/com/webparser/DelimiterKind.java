package com.webparser;

public enum DelimiterKind {
    PAREN("(", ")"),
    SQUARE_BRACKET("[", "]"),
    META_COMMENT("{", "}");

    private final String open;
    private final String close;

    DelimiterKind(String open, String close) {
        this.open = open;
        this.close = close;
    }

    public String open() {
        return open;
    }

    public String close() {
        return close;
    }

    /**
     * The kind whose opening or closing text is {@code text}. WEB writes
     * meta-comment braces with a leading {@code @}, which is accepted too.
     *
     * @return the kind, or null if {@code text} is not a delimiter
     */
    public static DelimiterKind fromText(String text) {
        String bare = text.startsWith("@") ? text.substring(1) : text;
        for (DelimiterKind kind : values()) {
            if (kind.open.equals(bare) || kind.close.equals(bare)) {
                return kind;
            }
        }
        return null;
    }
}
