package com.webparser;

import com.webparser.ast.BinaryExpr;
import com.webparser.ast.CallExpr;
import com.webparser.ast.FieldAccessExpr;
import com.webparser.ast.FormatExpr;
import com.webparser.ast.IndexExpr;
import com.webparser.ast.IndexTerm;
import com.webparser.ast.ParenExpr;
import com.webparser.ast.PostfixUnaryExpr;
import com.webparser.ast.PrefixUnaryExpr;
import com.webparser.ast.TokenExpr;
import com.webparser.ast.WebExpr;

import java.util.List;
import java.util.function.UnaryOperator;

import static com.webparser.Combinators.closeDelimiter;
import static com.webparser.Combinators.identifier;
import static com.webparser.Combinators.intLiteral;
import static com.webparser.Combinators.mergedStringLiterals;
import static com.webparser.Combinators.openDelimiter;
import static com.webparser.Combinators.separatedList0;
import static com.webparser.Combinators.token;

/**
 * Pascal expression grammar.
 *
 * <p>The grammar is left-recursive as written ({@code expr := expr + expr | expr(args) | ...}),
 * so it is parsed as a non-left-recursive head followed by any number of tails,
 * each tail folded onto the expression built so far. There are no precedence
 * levels: the right operand of a binary operator is a full expression.</p>
 */
public final class ExpressionParser {

    private ExpressionParser() {
    }

    // ========================================================================
    // Entry points
    // ========================================================================

    public static Parsed<WebExpr> parseExpr(TokenCursor in) {
        Parsed<WebExpr> head = Combinators.<WebExpr>alt(in,
            ExpressionParser::prefixUnary,
            ExpressionParser::paren,
            ExpressionParser::stringLiteral,
            ExpressionParser::atom);

        return foldTails(head, List.of(
            ExpressionParser::binaryTail,
            ExpressionParser::callTail,
            ExpressionParser::indexTail,
            ExpressionParser::fieldTail,
            ExpressionParser::formatTail,
            ExpressionParser::postfixTail));
    }

    /**
     * The target of an assignment (or the left side of a macro definition): an
     * atom with call, index and field tails only.
     */
    public static Parsed<WebExpr> parseLhsExpr(TokenCursor in) {
        return foldTails(atom(in), List.of(
            ExpressionParser::callTail,
            ExpressionParser::indexTail,
            ExpressionParser::fieldTail));
    }

    /**
     * A case label: a string or an atom, with at most one call tail.
     */
    public static Parsed<WebExpr> parseCaseMatchExpr(TokenCursor in) {
        Parsed<WebExpr> head = Combinators.<WebExpr>alt(in,
            ExpressionParser::stringLiteral,
            ExpressionParser::atom);

        try {
            Parsed<UnaryOperator<WebExpr>> tail = callTail(head.rest());
            return new Parsed<>(tail.rest(), tail.value().apply(head.value()));
        } catch (ExpectedTokenException e) {
            return head;
        }
    }

    private static Parsed<WebExpr> foldTails(Parsed<WebExpr> head, List<Production<UnaryOperator<WebExpr>>> tails) {
        TokenCursor c = head.rest();
        WebExpr expr = head.value();

        outer:
        while (true) {
            for (Production<UnaryOperator<WebExpr>> tail : tails) {
                Parsed<UnaryOperator<WebExpr>> t;
                try {
                    t = tail.parse(c);
                } catch (ExpectedTokenException e) {
                    continue;
                }
                c = t.rest();
                expr = t.value().apply(expr);
                continue outer;
            }
            return new Parsed<>(c, expr);
        }
    }

    // ========================================================================
    // Heads
    // ========================================================================

    private static Parsed<WebExpr> prefixUnary(TokenCursor in) {
        Token op = in.peek();
        if (!(op.is(TokenType.PLUS) || op.is(TokenType.MINUS) || op.isReserved(ReservedWord.NOT))) {
            throw new ExpectedTokenException(ParseErrorKind.EXPECTED_PASCAL_TOKEN, in);
        }
        Parsed<WebExpr> inner = parseExpr(in.advance());
        return new Parsed<>(inner.rest(), new PrefixUnaryExpr(op, inner.value()));
    }

    private static Parsed<WebExpr> paren(TokenCursor in) {
        TokenCursor c = openDelimiter(in, DelimiterKind.PAREN).rest();
        Parsed<WebExpr> inner = parseExpr(c);
        c = closeDelimiter(inner.rest(), DelimiterKind.PAREN).rest();
        return new Parsed<>(c, new ParenExpr(inner.value()));
    }

    private static Parsed<WebExpr> stringLiteral(TokenCursor in) {
        Parsed<Token> s = mergedStringLiterals(in);
        return new Parsed<>(s.rest(), new TokenExpr(s.value()));
    }

    /**
     * A single-token expression: identifier, {@code nil}, macro parameter,
     * integer literal or string pool checksum.
     */
    static Parsed<WebExpr> atom(TokenCursor in) {
        Token t = in.peek();
        boolean ok = switch (t.type()) {
            case IDENTIFIER, HASH, INT_LITERAL, STRING_POOL_CHECKSUM -> true;
            case FORMATTED_IDENTIFIER, RESERVED_WORD -> t.word() == ReservedWord.NIL;
            default -> false;
        };
        if (!ok) {
            throw new ExpectedTokenException(ParseErrorKind.EXPECTED_PASCAL_TOKEN, in);
        }
        return new Parsed<>(in.advance(), new TokenExpr(t));
    }

    // ========================================================================
    // Tails
    // ========================================================================

    static boolean isBinaryOperator(Token t) {
        return switch (t.type()) {
            case PLUS, MINUS, TIMES, DIVIDE, GREATER, GREATER_EQUALS, LESS, LESS_EQUALS, EQUALS, NOT_EQUALS -> true;
            case RESERVED_WORD -> t.word() == ReservedWord.AND
                || t.word() == ReservedWord.DIV
                || t.word() == ReservedWord.MOD
                || t.word() == ReservedWord.OR;
            default -> false;
        };
    }

    private static Parsed<UnaryOperator<WebExpr>> binaryTail(TokenCursor in) {
        Token op = in.peek();
        if (!isBinaryOperator(op)) {
            throw new ExpectedTokenException(ParseErrorKind.EXPECTED_PASCAL_TOKEN, in);
        }
        Parsed<WebExpr> rhs = parseExpr(in.advance());
        return new Parsed<>(rhs.rest(), lhs -> new BinaryExpr(lhs, op, rhs.value()));
    }

    private static Parsed<UnaryOperator<WebExpr>> callTail(TokenCursor in) {
        TokenCursor c = openDelimiter(in, DelimiterKind.PAREN).rest();
        Parsed<List<WebExpr>> args = separatedList0(c, TokenType.COMMA, ExpressionParser::parseExpr);
        c = closeDelimiter(args.rest(), DelimiterKind.PAREN).rest();
        return new Parsed<>(c, target -> new CallExpr(target, args.value()));
    }

    private static Parsed<UnaryOperator<WebExpr>> indexTail(TokenCursor in) {
        TokenCursor c = openDelimiter(in, DelimiterKind.SQUARE_BRACKET).rest();
        Parsed<List<IndexTerm>> args = separatedList0(c, TokenType.COMMA, ExpressionParser::indexTerm);
        c = closeDelimiter(args.rest(), DelimiterKind.SQUARE_BRACKET).rest();
        return new Parsed<>(c, target -> new IndexExpr(target, args.value()));
    }

    private static Parsed<IndexTerm> indexTerm(TokenCursor in) {
        return Combinators.<IndexTerm>alt(in,
            c -> {
                Parsed<WebExpr> from = atom(c);
                TokenCursor next = token(from.rest(), TokenType.DOUBLE_DOT).rest();
                Parsed<WebExpr> to = parseExpr(next);
                return new Parsed<IndexTerm>(to.rest(), new IndexTerm.Range(from.value(), to.value()));
            },
            c -> {
                Parsed<WebExpr> e = parseExpr(c);
                return new Parsed<IndexTerm>(e.rest(), new IndexTerm.Expr(e.value()));
            });
    }

    private static Parsed<UnaryOperator<WebExpr>> fieldTail(TokenCursor in) {
        TokenCursor c = token(in, TokenType.PERIOD).rest();
        Parsed<Token> field = identifier(c);
        return new Parsed<>(field.rest(), item -> new FieldAccessExpr(item, field.value()));
    }

    private static Parsed<UnaryOperator<WebExpr>> formatTail(TokenCursor in) {
        TokenCursor c = token(in, TokenType.COLON).rest();
        Parsed<Token> width = intLiteral(c);
        return new Parsed<>(width.rest(), inner -> new FormatExpr(inner, width.value()));
    }

    private static Parsed<UnaryOperator<WebExpr>> postfixTail(TokenCursor in) {
        Parsed<Token> op = token(in, TokenType.CARET);
        return new Parsed<>(op.rest(), inner -> new PostfixUnaryExpr(inner, op.value()));
    }
}
