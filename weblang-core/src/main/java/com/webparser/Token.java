package com.webparser;

import com.webparser.prettify.Prettifier;
import com.webparser.prettify.RenderInline;

/**
 * A token of WEB Pascal, as handed over by the external lexer.
 *
 * @param type      the token kind
 * @param text      the source text (the module name for module references, the body for comments)
 * @param word      the reserved word for RESERVED_WORD tokens, or the word a FORMATTED_IDENTIFIER behaves like
 * @param delimiter the delimiter kind for OPEN_DELIMITER and CLOSE_DELIMITER tokens
 * @param start     start offset of the span in the WEB source
 * @param end       end offset of the span in the WEB source
 */
public record Token(
    TokenType type,
    String text,
    ReservedWord word,
    DelimiterKind delimiter,
    int start,
    int end
) implements RenderInline {

    public Token {
        if (type == null) {
            throw new IllegalArgumentException("token type must not be null");
        }
        if (text == null) {
            text = "";
        }
        if (type == TokenType.RESERVED_WORD && word == null) {
            word = ReservedWord.lookup(text);
        }
        if (delimiter == null && (type == TokenType.OPEN_DELIMITER || type == TokenType.CLOSE_DELIMITER)) {
            delimiter = DelimiterKind.fromText(text);
        }
    }

    public Token(TokenType type, String text) {
        this(type, text, null, null, 0, 0);
    }

    public static Token identifier(String name) {
        return new Token(TokenType.IDENTIFIER, name);
    }

    public static Token reserved(ReservedWord word) {
        return new Token(TokenType.RESERVED_WORD, word.pascalName(), word, null, 0, 0);
    }

    public static Token formattedIdentifier(String name, ReservedWord like) {
        return new Token(TokenType.FORMATTED_IDENTIFIER, name, like, null, 0, 0);
    }

    public static Token open(DelimiterKind kind) {
        return new Token(TokenType.OPEN_DELIMITER, kind.open(), null, kind, 0, 0);
    }

    public static Token close(DelimiterKind kind) {
        return new Token(TokenType.CLOSE_DELIMITER, kind.close(), null, kind, 0, 0);
    }

    public boolean is(TokenType t) {
        return type == t;
    }

    public boolean isReserved(ReservedWord w) {
        return type == TokenType.RESERVED_WORD && word == w;
    }

    public boolean isFormattedLike(ReservedWord w) {
        return type == TokenType.FORMATTED_IDENTIFIER && word == w;
    }

    public boolean isOpen(DelimiterKind kind) {
        return type == TokenType.OPEN_DELIMITER && delimiter == kind;
    }

    public boolean isClose(DelimiterKind kind) {
        return type == TokenType.CLOSE_DELIMITER && delimiter == kind;
    }

    /**
     * The text this token renders as in prettified output.
     */
    public String displayText() {
        return switch (type) {
            case RESERVED_WORD -> word != null ? word.pascalName() : text;
            case INT_LITERAL -> {
                if (text.startsWith("\"")) {
                    yield "0x" + text.substring(1);
                } else if (text.startsWith("'")) {
                    yield "0o" + text.substring(1);
                }
                yield text;
            }
            case HASH -> "#";
            case STRING_POOL_CHECKSUM -> "@$";
            case PLUS -> "+";
            case MINUS -> "-";
            case TIMES -> "*";
            case DIVIDE -> "/";
            case GREATER -> ">";
            case GREATER_EQUALS -> ">=";
            case LESS -> "<";
            case LESS_EQUALS -> "<=";
            case EQUALS -> "=";
            case NOT_EQUALS -> "<>";
            case GETS -> ":=";
            case EQUIVALENCE -> "==";
            case DOUBLE_DOT -> "..";
            case PERIOD -> ".";
            case COMMA -> ",";
            case COLON -> ":";
            case SEMICOLON -> ";";
            case CARET -> "^";
            case OPEN_DELIMITER -> delimiter != null ? delimiter.open() : text;
            case CLOSE_DELIMITER -> delimiter != null ? delimiter.close() : text;
            case COMMENT -> "/* " + text + " */";
            case MODULE_REFERENCE -> "<" + text + ">";
            case DEFINE -> "@define";
            case FORMAT -> "@format";
            case COMPILER_DIRECTIVE -> "{" + text + "}";
            case FORMATTING, FORCED_EOL, TEX_STRING -> "";
            default -> text;
        };
    }

    @Override
    public int measureInline() {
        return displayText().length();
    }

    @Override
    public void renderInline(Prettifier dest) {
        switch (type) {
            case RESERVED_WORD, FORMATTED_IDENTIFIER -> dest.keyword(displayText());
            case STRING_LITERAL -> dest.scopePush(dest.scopes().stringLiteral(), displayText());
            case INT_LITERAL -> {
                if (text.startsWith("\"")) {
                    dest.scopePush(dest.scopes().hexLiteral(), displayText());
                } else if (text.startsWith("'")) {
                    dest.scopePush(dest.scopes().octalLiteral(), displayText());
                } else {
                    dest.scopePush(dest.scopes().decimalLiteral(), displayText());
                }
            }
            case COMMENT, COMPILER_DIRECTIVE -> dest.scopePush(dest.scopes().comment(), displayText());
            case MODULE_REFERENCE -> dest.moduleReference(text);
            case FORMATTING, FORCED_EOL, TEX_STRING -> {
            }
            default -> dest.noscopePush(displayText());
        }
    }

    @Override
    public String toString() {
        return word != null ? type + "(" + text + "~" + word + ")" : type + "(" + text + ")";
    }
}
