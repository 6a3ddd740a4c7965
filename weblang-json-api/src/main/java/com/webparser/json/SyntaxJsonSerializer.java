package com.webparser.json;

import com.webparser.ast.SyntaxNode;
import com.webparser.ast.WebCode;
import com.webparser.prettify.PrettifiedCode;

/**
 * Interface for serializing syntax trees and layout results to JSON.
 */
public interface SyntaxJsonSerializer {

    /**
     * Serializes a parsed code section. Every node carries its kind under {@code "type"}.
     *
     * @param code the tree to serialize
     * @return the JSON representation
     * @throws SyntaxJsonException if serialization fails
     */
    String serialize(WebCode code) throws SyntaxJsonException;

    /**
     * Serializes a parsed code section as pretty-printed JSON.
     */
    String serializePretty(WebCode code) throws SyntaxJsonException;

    /**
     * Serializes a single node.
     */
    String serializeNode(SyntaxNode node) throws SyntaxJsonException;

    /**
     * Serializes a layout result: text, scope operations and inserts.
     */
    String serialize(PrettifiedCode code) throws SyntaxJsonException;
}
