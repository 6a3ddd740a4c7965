package com.webparser;

import com.webparser.ast.Assignment;
import com.webparser.ast.Block;
import com.webparser.ast.Case;
import com.webparser.ast.CaseItem;
import com.webparser.ast.ExprStatement;
import com.webparser.ast.For;
import com.webparser.ast.FreeCase;
import com.webparser.ast.Goto;
import com.webparser.ast.If;
import com.webparser.ast.Label;
import com.webparser.ast.Loop;
import com.webparser.ast.ModuleReferenceStatement;
import com.webparser.ast.PreprocessorDirective;
import com.webparser.ast.Repeat;
import com.webparser.ast.WebExpr;
import com.webparser.ast.WebStatement;
import com.webparser.ast.While;

import java.util.List;

import static com.webparser.Combinators.closeDelimiter;
import static com.webparser.Combinators.identifier;
import static com.webparser.Combinators.many0;
import static com.webparser.Combinators.many1;
import static com.webparser.Combinators.moduleReference;
import static com.webparser.Combinators.openDelimiter;
import static com.webparser.Combinators.opt;
import static com.webparser.Combinators.reservedWord;
import static com.webparser.Combinators.separatedList1;
import static com.webparser.Combinators.skipSemicolon;
import static com.webparser.Combinators.token;
import static com.webparser.Combinators.wordOrFormattedLike;

/**
 * Pascal statement grammar.
 *
 * <p>Alternatives are tried in a fixed order; the expression statement comes
 * last since almost anything starts with an expression.</p>
 */
public final class StatementParser {

    private StatementParser() {
    }

    public static Parsed<WebStatement> parseStatement(TokenCursor in) {
        return Combinators.<WebStatement>alt(in,
            StatementParser::moduleReferenceStatement,
            StatementParser::block,
            StatementParser::preprocessorDirective,
            StatementParser::gotoStatement,
            StatementParser::ifStatement,
            StatementParser::whileStatement,
            StatementParser::forStatement,
            StatementParser::repeatStatement,
            StatementParser::caseStatement,
            StatementParser::assignment,
            StatementParser::label,
            StatementParser::loop,
            StatementParser::freeCase,
            StatementParser::exprStatement);
    }

    // ========================================================================
    // Simple statements
    // ========================================================================

    private static Parsed<WebStatement> moduleReferenceStatement(TokenCursor in) {
        Parsed<Token> module = moduleReference(in);
        return new Parsed<>(skipSemicolon(module.rest()), new ModuleReferenceStatement(module.value()));
    }

    /**
     * A meta-comment holding a compiler directive, {@code @{$C-,A+@}}.
     */
    private static Parsed<WebStatement> preprocessorDirective(TokenCursor in) {
        TokenCursor c = openDelimiter(in, DelimiterKind.META_COMMENT).rest();
        Parsed<Token> directive = token(c, TokenType.COMPILER_DIRECTIVE);
        c = closeDelimiter(directive.rest(), DelimiterKind.META_COMMENT).rest();
        return new Parsed<>(c, new PreprocessorDirective(directive.value()));
    }

    private static Parsed<WebStatement> gotoStatement(TokenCursor in) {
        TokenCursor c = reservedWord(in, ReservedWord.GOTO).rest();
        Parsed<Token> label = identifier(c);
        c = skipSemicolon(label.rest());
        Parsed<Token> comment = opt(c, Combinators::comment);
        return new Parsed<>(comment.rest(), new Goto(label.value(), comment.value()));
    }

    private static Parsed<WebStatement> assignment(TokenCursor in) {
        Parsed<WebExpr> lhs = ExpressionParser.parseLhsExpr(in);
        TokenCursor c = token(lhs.rest(), TokenType.GETS).rest();
        Parsed<WebExpr> rhs = ExpressionParser.parseExpr(c);
        c = skipSemicolon(rhs.rest());
        Parsed<Token> comment = opt(c, Combinators::comment);
        return new Parsed<>(comment.rest(), new Assignment(lhs.value(), rhs.value(), comment.value()));
    }

    private static Parsed<WebStatement> label(TokenCursor in) {
        Parsed<Token> name = identifier(in);
        TokenCursor c = token(name.rest(), TokenType.COLON).rest();
        return new Parsed<>(c, new Label(name.value()));
    }

    private static Parsed<WebStatement> exprStatement(TokenCursor in) {
        Parsed<WebExpr> expr = ExpressionParser.parseExpr(in);
        TokenCursor c = skipSemicolon(expr.rest());
        Parsed<Token> comment = opt(c, Combinators::comment);
        return new Parsed<>(comment.rest(), new ExprStatement(expr.value(), comment.value()));
    }

    // ========================================================================
    // Compound statements
    // ========================================================================

    static Parsed<Block> parseBlock(TokenCursor in) {
        Parsed<Token> opener = wordOrFormattedLike(in, ReservedWord.BEGIN);
        Parsed<List<WebStatement>> statements = many0(opener.rest(), StatementParser::parseStatement);
        Parsed<Token> closer = wordOrFormattedLike(statements.rest(), ReservedWord.END);
        TokenCursor c = skipSemicolon(closer.rest());
        Parsed<Token> comment = opt(c, Combinators::comment);
        return new Parsed<>(comment.rest(),
            new Block(opener.value(), statements.value(), closer.value(), comment.value()));
    }

    private static Parsed<WebStatement> block(TokenCursor in) {
        Parsed<Block> b = parseBlock(in);
        return new Parsed<>(b.rest(), b.value());
    }

    private static Parsed<WebStatement> ifStatement(TokenCursor in) {
        TokenCursor c = reservedWord(in, ReservedWord.IF).rest();
        Parsed<WebExpr> test = ExpressionParser.parseExpr(c);
        c = reservedWord(test.rest(), ReservedWord.THEN).rest();
        Parsed<WebStatement> then = parseStatement(c);
        c = then.rest();

        WebStatement otherwise = null;
        if (!c.isAtEnd() && c.peek().isReserved(ReservedWord.ELSE)) {
            Parsed<WebStatement> e = parseStatement(c.advance());
            otherwise = e.value();
            c = e.rest();
        }

        return new Parsed<>(c, new If(test.value(), then.value(), otherwise));
    }

    private static Parsed<WebStatement> whileStatement(TokenCursor in) {
        TokenCursor c = reservedWord(in, ReservedWord.WHILE).rest();
        Parsed<WebExpr> test = ExpressionParser.parseExpr(c);
        c = reservedWord(test.rest(), ReservedWord.DO).rest();
        Parsed<WebStatement> body = parseStatement(c);
        return new Parsed<>(body.rest(), new While(test.value(), body.value()));
    }

    private static Parsed<WebStatement> forStatement(TokenCursor in) {
        TokenCursor c = reservedWord(in, ReservedWord.FOR).rest();
        Parsed<Token> variable = identifier(c);
        c = token(variable.rest(), TokenType.GETS).rest();
        Parsed<WebExpr> from = ExpressionParser.parseExpr(c);
        Parsed<Token> direction = Combinators.<Token>alt(from.rest(),
            reservedWord(ReservedWord.TO),
            reservedWord(ReservedWord.DOWNTO));
        Parsed<WebExpr> to = ExpressionParser.parseExpr(direction.rest());
        c = reservedWord(to.rest(), ReservedWord.DO).rest();
        Parsed<WebStatement> body = parseStatement(c);
        return new Parsed<>(body.rest(),
            new For(variable.value(), from.value(), direction.value(), to.value(), body.value()));
    }

    private static Parsed<WebStatement> repeatStatement(TokenCursor in) {
        TokenCursor c = reservedWord(in, ReservedWord.REPEAT).rest();
        Parsed<List<WebStatement>> statements = many0(c, StatementParser::parseStatement);
        c = reservedWord(statements.rest(), ReservedWord.UNTIL).rest();
        Parsed<WebExpr> until = ExpressionParser.parseExpr(c);
        c = skipSemicolon(until.rest());
        return new Parsed<>(c, new Repeat(statements.value(), until.value()));
    }

    /**
     * A looping construct introduced by a macro the lexer tagged as a loop clause.
     */
    private static Parsed<WebStatement> loop(TokenCursor in) {
        Token keyword = in.peek();
        if (!keyword.isFormattedLike(ReservedWord.XCLAUSE)) {
            throw new ExpectedTokenException(ParseErrorKind.EXPECTED_RESERVED_WORD, in);
        }
        Parsed<WebStatement> body = parseStatement(in.advance());
        return new Parsed<>(body.rest(), new Loop(keyword, body.value()));
    }

    // ========================================================================
    // Case
    // ========================================================================

    private static Parsed<WebStatement> caseStatement(TokenCursor in) {
        TokenCursor c = reservedWord(in, ReservedWord.CASE).rest();
        Parsed<WebExpr> selector = ExpressionParser.parseExpr(c);
        c = reservedWord(selector.rest(), ReservedWord.OF).rest();
        Parsed<List<CaseItem>> items = many1(c, StatementParser::caseItem);
        Parsed<Token> terminator = Combinators.formattedIdentifierLike(items.rest(), ReservedWord.END);
        c = skipSemicolon(terminator.rest());
        return new Parsed<>(c, new Case(selector.value(), items.value(), terminator.value()));
    }

    private static Parsed<CaseItem> caseItem(TokenCursor in) {
        return Combinators.<CaseItem>alt(in,
            StatementParser::moduleReferenceCaseItem,
            StatementParser::otherCasesItem,
            StatementParser::standardCaseItem);
    }

    private static Parsed<CaseItem> moduleReferenceCaseItem(TokenCursor in) {
        Parsed<Token> module = moduleReference(in);
        return new Parsed<>(skipSemicolon(module.rest()), new CaseItem.ModuleReference(module.value()));
    }

    private static Parsed<CaseItem> otherCasesItem(TokenCursor in) {
        Parsed<Token> tag = Combinators.formattedIdentifierLike(in, ReservedWord.ELSE);
        Parsed<WebStatement> stmt = parseStatement(tag.rest());
        TokenCursor c = skipSemicolon(stmt.rest());
        Parsed<Token> comment = opt(c, Combinators::comment);
        return new Parsed<>(comment.rest(), new CaseItem.OtherCases(tag.value(), stmt.value(), comment.value()));
    }

    private static Parsed<CaseItem> standardCaseItem(TokenCursor in) {
        Parsed<List<WebExpr>> matches = separatedList1(in, TokenType.COMMA, ExpressionParser::parseCaseMatchExpr);
        TokenCursor c = token(matches.rest(), TokenType.COLON).rest();
        Parsed<WebStatement> stmt = parseStatement(c);
        c = skipSemicolon(stmt.rest());
        Parsed<Token> comment = opt(c, Combinators::comment);
        return new Parsed<>(comment.rest(), new CaseItem.Standard(matches.value(), stmt.value(), comment.value()));
    }

    /**
     * Case arms outside a case statement, labelled by strings.
     */
    private static Parsed<WebStatement> freeCase(TokenCursor in) {
        Parsed<List<Token>> matches = separatedList1(in, TokenType.COMMA, Combinators::mergedStringLiterals);
        TokenCursor c = token(matches.rest(), TokenType.COLON).rest();
        Parsed<WebStatement> stmt = parseStatement(c);
        c = skipSemicolon(stmt.rest());
        return new Parsed<>(c, new FreeCase(matches.value(), stmt.value()));
    }
}
