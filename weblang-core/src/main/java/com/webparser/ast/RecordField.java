package com.webparser.ast;

import com.webparser.Token;

import java.util.List;

/**
 * {@code names : type ;} with an optional trailing comment.
 */
public record RecordField(List<Token> names, WebType fieldType, Token comment) implements SyntaxNode {

    public RecordField {
        names = List.copyOf(names);
    }
}
