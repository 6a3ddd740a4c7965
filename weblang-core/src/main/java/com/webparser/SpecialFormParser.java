package com.webparser;

import com.webparser.ast.ForwardDeclaration;
import com.webparser.ast.FunctionDefinition;
import com.webparser.ast.ListLiteralTerm;
import com.webparser.ast.SpecialArrayMacro;
import com.webparser.ast.SpecialCoeffArray;
import com.webparser.ast.SpecialCommaExprs;
import com.webparser.ast.SpecialCommentedOut;
import com.webparser.ast.SpecialEmptyBrackets;
import com.webparser.ast.SpecialExprPeriod;
import com.webparser.ast.SpecialFloatEquality;
import com.webparser.ast.SpecialIdentInListLiteral;
import com.webparser.ast.SpecialIfdefForward;
import com.webparser.ast.SpecialIfdefFunction;
import com.webparser.ast.SpecialIfdefVarDeclaration;
import com.webparser.ast.SpecialImbalancedEnd;
import com.webparser.ast.SpecialInlineDefine;
import com.webparser.ast.SpecialListLiteral;
import com.webparser.ast.SpecialListLiteralAssignment;
import com.webparser.ast.SpecialParenTwoIdent;
import com.webparser.ast.SpecialRange;
import com.webparser.ast.SpecialRelationalExpr;
import com.webparser.ast.VarDeclaration;
import com.webparser.ast.WebExpr;
import com.webparser.ast.WebStatement;
import com.webparser.ast.WebToplevel;

import java.util.List;

import static com.webparser.Combinators.closeDelimiter;
import static com.webparser.Combinators.formattedIdentifierLike;
import static com.webparser.Combinators.identifier;
import static com.webparser.Combinators.intLiteral;
import static com.webparser.Combinators.many1;
import static com.webparser.Combinators.openDelimiter;
import static com.webparser.Combinators.opt;
import static com.webparser.Combinators.peekEndOfDefine;
import static com.webparser.Combinators.reservedWord;
import static com.webparser.Combinators.separatedList1;
import static com.webparser.Combinators.token;

/**
 * Irregular toplevel forms. WEB macros routinely hold fragments that are not
 * complete Pascal constructs: half a comparison, a bare range, an
 * {@code end;} closing a block opened in another macro. Each production here
 * recognizes one such fragment.
 */
public final class SpecialFormParser {

    private SpecialFormParser() {
    }

    /**
     * Tries every special form in its fixed order. Longer forms come before
     * the shorter ones they start with.
     */
    public static Parsed<WebToplevel> parseSpecial(TokenCursor in) {
        return Combinators.<WebToplevel>alt(in,
            SpecialFormParser::ifdefForward,
            SpecialFormParser::ifdefFunction,
            SpecialFormParser::ifdefVarDeclaration,
            SpecialFormParser::parenTwoIdent,
            SpecialFormParser::emptyBrackets,
            SpecialFormParser::relationalExpr,
            SpecialFormParser::range,
            SpecialFormParser::commentedOut,
            SpecialFormParser::arrayMacro,
            SpecialFormParser::listLiteralAssignment,
            SpecialFormParser::listLiteral,
            SpecialFormParser::identInListLiteral,
            SpecialFormParser::inlineDefine,
            SpecialFormParser::commaExprs,
            SpecialFormParser::floatEquality,
            SpecialFormParser::coeffArray,
            SpecialFormParser::imbalancedEnd,
            SpecialFormParser::exprPeriod);
    }

    // ========================================================================
    // Conditional compilation
    // ========================================================================

    static Parsed<WebToplevel> ifdefForward(TokenCursor in) {
        Parsed<Token> begin = formattedIdentifierLike(in, ReservedWord.BEGIN);
        Parsed<ForwardDeclaration> decl = DeclarationParser.parseForwardDeclarationBase(begin.rest());
        Parsed<Token> end = formattedIdentifierLike(decl.rest(), ReservedWord.END);
        return new Parsed<>(end.rest(), new SpecialIfdefForward(begin.value(), decl.value(), end.value()));
    }

    static Parsed<WebToplevel> ifdefFunction(TokenCursor in) {
        Parsed<Token> begin = formattedIdentifierLike(in, ReservedWord.BEGIN);
        Parsed<FunctionDefinition> def = DeclarationParser.parseFunctionDefinitionBase(begin.rest());
        Parsed<Token> end = formattedIdentifierLike(def.rest(), ReservedWord.END);
        return new Parsed<>(end.rest(), new SpecialIfdefFunction(begin.value(), def.value(), end.value()));
    }

    static Parsed<WebToplevel> ifdefVarDeclaration(TokenCursor in) {
        Parsed<Token> leading = opt(in, Combinators::comment);
        Parsed<Token> begin = formattedIdentifierLike(leading.rest(), ReservedWord.BEGIN);
        Parsed<List<VarDeclaration>> decls = many1(begin.rest(), DeclarationParser::parseVarDeclarationBase);
        Parsed<Token> end = formattedIdentifierLike(decls.rest(), ReservedWord.END);
        Parsed<Token> trailing = opt(end.rest(), Combinators::comment);
        return new Parsed<>(trailing.rest(), new SpecialIfdefVarDeclaration(
            leading.value(), begin.value(), decls.value(), end.value(), trailing.value()));
    }

    /**
     * {@code @{ stmt @}}: a statement disabled by wrapping it in a meta-comment.
     */
    static Parsed<WebToplevel> commentedOut(TokenCursor in) {
        TokenCursor c = openDelimiter(in, DelimiterKind.META_COMMENT).rest();
        Parsed<WebStatement> stmt = StatementParser.parseStatement(c);
        c = closeDelimiter(stmt.rest(), DelimiterKind.META_COMMENT).rest();
        return new Parsed<>(c, new SpecialCommentedOut(stmt.value()));
    }

    // ========================================================================
    // Expression fragments
    // ========================================================================

    static Parsed<WebToplevel> parenTwoIdent(TokenCursor in) {
        TokenCursor c = openDelimiter(in, DelimiterKind.PAREN).rest();
        Parsed<Token> first = identifier(c);
        Parsed<Token> second = identifier(first.rest());
        c = closeDelimiter(second.rest(), DelimiterKind.PAREN).rest();
        return new Parsed<>(c, new SpecialParenTwoIdent(first.value(), second.value()));
    }

    static Parsed<WebToplevel> emptyBrackets(TokenCursor in) {
        TokenCursor c = openDelimiter(in, DelimiterKind.SQUARE_BRACKET).rest();
        c = closeDelimiter(c, DelimiterKind.SQUARE_BRACKET).rest();
        return new Parsed<>(c, new SpecialEmptyBrackets());
    }

    static Parsed<WebToplevel> relationalExpr(TokenCursor in) {
        Parsed<Token> op = Combinators.oneOf(in,
            TokenType.EQUALS, TokenType.NOT_EQUALS,
            TokenType.GREATER, TokenType.GREATER_EQUALS,
            TokenType.LESS, TokenType.LESS_EQUALS);
        Parsed<WebExpr> expr = ExpressionParser.parseExpr(op.rest());
        return new Parsed<>(expr.rest(), new SpecialRelationalExpr(op.value(), expr.value()));
    }

    static Parsed<WebToplevel> range(TokenCursor in) {
        Parsed<WebExpr> from = ExpressionParser.parseExpr(in);
        TokenCursor c = token(from.rest(), TokenType.DOUBLE_DOT).rest();
        Parsed<WebExpr> to = ExpressionParser.parseExpr(c);
        return new Parsed<>(to.rest(), new SpecialRange(from.value(), to.value()));
    }

    /**
     * {@code [from .. to] name}, part of a TeX table macro idiom.
     */
    static Parsed<WebToplevel> arrayMacro(TokenCursor in) {
        TokenCursor c = openDelimiter(in, DelimiterKind.SQUARE_BRACKET).rest();
        Parsed<WebExpr> from = ExpressionParser.parseExpr(c);
        c = token(from.rest(), TokenType.DOUBLE_DOT).rest();
        Parsed<WebExpr> to = ExpressionParser.parseExpr(c);
        c = closeDelimiter(to.rest(), DelimiterKind.SQUARE_BRACKET).rest();
        Parsed<Token> name = identifier(c);
        return new Parsed<>(name.rest(), new SpecialArrayMacro(from.value(), to.value(), name.value()));
    }

    static Parsed<WebToplevel> inlineDefine(TokenCursor in) {
        Parsed<WebExpr> lhs = ExpressionParser.parseExpr(in);
        TokenCursor c = token(lhs.rest(), TokenType.EQUIVALENCE).rest();
        Parsed<WebExpr> rhs = ExpressionParser.parseExpr(c);
        return new Parsed<>(rhs.rest(), new SpecialInlineDefine(lhs.value(), rhs.value()));
    }

    /**
     * A comma-separated expression list making up a whole macro body. A lone
     * expression without a trailing comma is left for the statement grammar.
     */
    static Parsed<WebToplevel> commaExprs(TokenCursor in) {
        Parsed<List<WebExpr>> exprs = separatedList1(in, TokenType.COMMA, ExpressionParser::parseExpr);
        Parsed<Token> trailing = opt(exprs.rest(), Combinators.token(TokenType.COMMA));
        TokenCursor c = peekEndOfDefine(trailing.rest()).rest();

        if (exprs.value().size() < 2 && trailing.value() == null) {
            throw new ExpectedTokenException(ParseErrorKind.REJECTED, in);
        }
        return new Parsed<>(c, new SpecialCommaExprs(exprs.value(), trailing.value() != null));
    }

    /**
     * {@code name = .25}.
     */
    static Parsed<WebToplevel> floatEquality(TokenCursor in) {
        Parsed<Token> name = identifier(in);
        TokenCursor c = token(name.rest(), TokenType.EQUALS).rest();
        c = token(c, TokenType.PERIOD).rest();
        Parsed<Token> fraction = intLiteral(c);
        return new Parsed<>(fraction.rest(), new SpecialFloatEquality(name.value(), fraction.value()));
    }

    /**
     * {@code name[2 base]}.
     */
    static Parsed<WebToplevel> coeffArray(TokenCursor in) {
        Parsed<Token> name = identifier(in);
        TokenCursor c = openDelimiter(name.rest(), DelimiterKind.SQUARE_BRACKET).rest();
        Parsed<Token> coeff = intLiteral(c);
        Parsed<Token> base = identifier(coeff.rest());
        c = closeDelimiter(base.rest(), DelimiterKind.SQUARE_BRACKET).rest();
        return new Parsed<>(c, new SpecialCoeffArray(name.value(), coeff.value(), base.value()));
    }

    static Parsed<WebToplevel> imbalancedEnd(TokenCursor in) {
        Parsed<Token> end = reservedWord(in, ReservedWord.END);
        TokenCursor c = token(end.rest(), TokenType.SEMICOLON).rest();
        c = peekEndOfDefine(c).rest();
        return new Parsed<>(c, new SpecialImbalancedEnd(end.value()));
    }

    static Parsed<WebToplevel> exprPeriod(TokenCursor in) {
        Parsed<WebExpr> expr = ExpressionParser.parseExpr(in);
        TokenCursor c = token(expr.rest(), TokenType.PERIOD).rest();
        c = peekEndOfDefine(c).rest();
        return new Parsed<>(c, new SpecialExprPeriod(expr.value()));
    }

    // ========================================================================
    // Integer lists
    // ========================================================================

    static Parsed<WebToplevel> listLiteralAssignment(TokenCursor in) {
        Parsed<List<ListLiteralTerm>> lhs = parenList(in);
        TokenCursor c = token(lhs.rest(), TokenType.GETS).rest();
        Parsed<List<ListLiteralTerm>> rhs = parenList(c);
        return new Parsed<>(rhs.rest(), new SpecialListLiteralAssignment(lhs.value(), rhs.value()));
    }

    static Parsed<WebToplevel> listLiteral(TokenCursor in) {
        return Combinators.<WebToplevel>alt(in,
            c -> {
                Parsed<List<ListLiteralTerm>> terms = squareList(c);
                return new Parsed<WebToplevel>(terms.rest(), new SpecialListLiteral(true, terms.value()));
            },
            c -> {
                Parsed<List<ListLiteralTerm>> terms = parenList(c);
                return new Parsed<WebToplevel>(terms.rest(), new SpecialListLiteral(false, terms.value()));
            });
    }

    static Parsed<WebToplevel> identInListLiteral(TokenCursor in) {
        Parsed<Token> name = identifier(in);
        TokenCursor c = reservedWord(name.rest(), ReservedWord.IN).rest();
        Parsed<List<ListLiteralTerm>> terms = squareList(c);
        return new Parsed<>(terms.rest(), new SpecialIdentInListLiteral(name.value(), terms.value()));
    }

    private static Parsed<List<ListLiteralTerm>> parenList(TokenCursor in) {
        TokenCursor c = openDelimiter(in, DelimiterKind.PAREN).rest();
        Parsed<List<ListLiteralTerm>> terms = separatedList1(c, TokenType.COMMA, SpecialFormParser::listTerm);
        c = closeDelimiter(terms.rest(), DelimiterKind.PAREN).rest();
        return new Parsed<>(c, terms.value());
    }

    private static Parsed<List<ListLiteralTerm>> squareList(TokenCursor in) {
        TokenCursor c = openDelimiter(in, DelimiterKind.SQUARE_BRACKET).rest();
        Parsed<List<ListLiteralTerm>> terms = separatedList1(c, TokenType.COMMA, SpecialFormParser::listTerm);
        c = closeDelimiter(terms.rest(), DelimiterKind.SQUARE_BRACKET).rest();
        return new Parsed<>(c, terms.value());
    }

    private static Parsed<ListLiteralTerm> listTerm(TokenCursor in) {
        return Combinators.<ListLiteralTerm>alt(in,
            c -> {
                Parsed<Token> from = intLiteral(c);
                TokenCursor next = token(from.rest(), TokenType.DOUBLE_DOT).rest();
                Parsed<Token> to = intLiteral(next);
                return new Parsed<ListLiteralTerm>(to.rest(), new ListLiteralTerm.Range(from.value(), to.value()));
            },
            c -> {
                Parsed<Token> t = Combinators.oneOf(c, TokenType.INT_LITERAL, TokenType.IDENTIFIER);
                return new Parsed<ListLiteralTerm>(t.rest(), new ListLiteralTerm.Single(t.value()));
            },
            c -> {
                Parsed<Token> op = token(c, TokenType.MINUS);
                Parsed<Token> operand = identifier(op.rest());
                return new Parsed<ListLiteralTerm>(operand.rest(), new ListLiteralTerm.Unary(op.value(), operand.value()));
            });
    }
}
