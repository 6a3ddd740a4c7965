package com.webparser.ast;

import com.webparser.prettify.Prettifier;
import com.webparser.prettify.RenderFlex;

/**
 * Pascal type expressions.
 */
public sealed interface WebType extends SyntaxNode, RenderFlex permits
    BuiltinType,
    RangeType,
    PackedFileOfType,
    ArrayType,
    RecordType,
    UserDefinedType,
    PointerType {

    @Override
    default void renderFlex(Prettifier dest) {
        renderInline(dest);
    }
}
