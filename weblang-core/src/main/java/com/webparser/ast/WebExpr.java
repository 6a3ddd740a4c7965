package com.webparser.ast;

import com.webparser.prettify.RenderFlex;

/**
 * Pascal expressions. There are no precedence levels: chained binary operators
 * group to the right exactly as written.
 */
public sealed interface WebExpr extends SyntaxNode, RenderFlex permits
    BinaryExpr,
    PrefixUnaryExpr,
    PostfixUnaryExpr,
    TokenExpr,
    CallExpr,
    IndexExpr,
    FieldAccessExpr,
    FormatExpr,
    ParenExpr {
}
