package com.webparser;

import com.webparser.ast.Block;
import com.webparser.ast.ConstDeclaration;
import com.webparser.ast.Define;
import com.webparser.ast.Format;
import com.webparser.ast.ForwardDeclaration;
import com.webparser.ast.FunctionDefinition;
import com.webparser.ast.FunctionHeader;
import com.webparser.ast.LabelDeclaration;
import com.webparser.ast.ModulifiedDeclaration;
import com.webparser.ast.ParameterGroup;
import com.webparser.ast.ProgramDefinition;
import com.webparser.ast.TypeDeclaration;
import com.webparser.ast.VarDeclaration;
import com.webparser.ast.WebExpr;
import com.webparser.ast.WebToplevel;
import com.webparser.ast.WebType;

import java.util.ArrayList;
import java.util.List;

import static com.webparser.Combinators.closeDelimiter;
import static com.webparser.Combinators.identifier;
import static com.webparser.Combinators.intLiteral;
import static com.webparser.Combinators.many0;
import static com.webparser.Combinators.many1;
import static com.webparser.Combinators.moduleReference;
import static com.webparser.Combinators.openDelimiter;
import static com.webparser.Combinators.opt;
import static com.webparser.Combinators.reservedWord;
import static com.webparser.Combinators.separatedList0;
import static com.webparser.Combinators.separatedList1;
import static com.webparser.Combinators.token;

/**
 * Declarations and WEB definitions, each a toplevel production.
 */
public final class DeclarationParser {

    private DeclarationParser() {
    }

    // ========================================================================
    // WEB definitions
    // ========================================================================

    /**
     * {@code @d lhs == body} or {@code @d lhs = body}. The body is itself a
     * single toplevel and may be missing.
     */
    public static Parsed<WebToplevel> parseDefine(TokenCursor in) {
        TokenCursor c = token(in, TokenType.DEFINE).rest();
        Parsed<WebExpr> lhs = ExpressionParser.parseLhsExpr(c);
        Parsed<Token> equals = Combinators.oneOf(lhs.rest(), TokenType.EQUIVALENCE, TokenType.EQUALS);
        c = equals.rest();

        WebToplevel body = null;
        if (!atEndOfDefine(c) && !c.peek().is(TokenType.COMMENT)) {
            Parsed<WebToplevel> b = ToplevelParser.parseToplevel(c);
            body = b.value();
            c = b.rest();
        }

        Parsed<Token> comment = opt(c, Combinators::comment);
        return new Parsed<>(comment.rest(), new Define(lhs.value(), equals.value(), body, comment.value()));
    }

    private static boolean atEndOfDefine(TokenCursor c) {
        try {
            Combinators.peekEndOfDefine(c);
            return true;
        } catch (ExpectedTokenException e) {
            return false;
        }
    }

    /**
     * {@code @f lhs == rhs}.
     */
    public static Parsed<WebToplevel> parseFormat(TokenCursor in) {
        TokenCursor c = token(in, TokenType.FORMAT).rest();
        Parsed<Token> lhs = Combinators.oneOf(c, TokenType.IDENTIFIER, TokenType.FORMATTED_IDENTIFIER);
        c = token(lhs.rest(), TokenType.EQUIVALENCE).rest();
        Parsed<Token> rhs = Combinators.oneOf(c,
            TokenType.IDENTIFIER, TokenType.FORMATTED_IDENTIFIER, TokenType.RESERVED_WORD);
        Parsed<Token> comment = opt(rhs.rest(), Combinators::comment);
        return new Parsed<>(comment.rest(), new Format(lhs.value(), rhs.value(), comment.value()));
    }

    // ========================================================================
    // Pascal declarations
    // ========================================================================

    public static Parsed<WebToplevel> parseProgram(TokenCursor in) {
        TokenCursor c = reservedWord(in, ReservedWord.PROGRAM).rest();
        Parsed<Token> name = identifier(c);
        c = name.rest();

        List<Token> parameters = List.of();
        if (!c.isAtEnd() && c.peek().isOpen(DelimiterKind.PAREN)) {
            Parsed<List<Token>> params = separatedList0(c.advance(), TokenType.COMMA, Combinators::identifier);
            c = closeDelimiter(params.rest(), DelimiterKind.PAREN).rest();
            parameters = params.value();
        }

        c = token(c, TokenType.SEMICOLON).rest();
        Parsed<Token> comment = opt(c, Combinators::comment);
        return new Parsed<>(comment.rest(), new ProgramDefinition(name.value(), parameters, comment.value()));
    }

    public static Parsed<WebToplevel> parseLabelDeclaration(TokenCursor in) {
        TokenCursor c = reservedWord(in, ReservedWord.LABEL).rest();
        Parsed<List<Token>> names = separatedList1(c, TokenType.COMMA, Combinators::identifier);
        c = token(names.rest(), TokenType.SEMICOLON).rest();
        Parsed<Token> comment = opt(c, Combinators::comment);
        return new Parsed<>(comment.rest(), new LabelDeclaration(names.value(), comment.value()));
    }

    /**
     * {@code const}, {@code type} or {@code var} followed by a module reference.
     */
    public static Parsed<WebToplevel> parseModulifiedDeclaration(TokenCursor in) {
        Parsed<Token> keyword = Combinators.<Token>alt(in,
            reservedWord(ReservedWord.CONST),
            reservedWord(ReservedWord.TYPE),
            reservedWord(ReservedWord.VAR));
        Parsed<Token> module = moduleReference(keyword.rest());
        return new Parsed<>(module.rest(), new ModulifiedDeclaration(keyword.value(), module.value()));
    }

    public static Parsed<WebToplevel> parseConstDeclaration(TokenCursor in) {
        TokenCursor c = opt(in, reservedWord(ReservedWord.CONST)).rest();
        Parsed<ConstDeclaration> decl = constDeclarationBase(c);
        return new Parsed<>(decl.rest(), decl.value());
    }

    private static Parsed<ConstDeclaration> constDeclarationBase(TokenCursor in) {
        Parsed<Token> name = identifier(in);
        TokenCursor c = token(name.rest(), TokenType.EQUALS).rest();
        Parsed<Token> value = intLiteral(c);
        c = token(value.rest(), TokenType.SEMICOLON).rest();
        Parsed<Token> comment = opt(c, Combinators::comment);
        return new Parsed<>(comment.rest(), new ConstDeclaration(name.value(), value.value(), comment.value()));
    }

    public static Parsed<WebToplevel> parseVarDeclaration(TokenCursor in) {
        Parsed<VarDeclaration> decl = parseVarDeclarationBase(in);
        return new Parsed<>(decl.rest(), decl.value());
    }

    static Parsed<VarDeclaration> parseVarDeclarationBase(TokenCursor in) {
        TokenCursor c = opt(in, reservedWord(ReservedWord.VAR)).rest();
        Parsed<List<Token>> names = separatedList1(c, TokenType.COMMA, Combinators::identifier);
        c = token(names.rest(), TokenType.COLON).rest();
        Parsed<WebType> type = TypeParser.parseType(c);
        c = token(type.rest(), TokenType.SEMICOLON).rest();
        Parsed<Token> comment = opt(c, Combinators::comment);
        return new Parsed<>(comment.rest(), new VarDeclaration(names.value(), type.value(), comment.value()));
    }

    public static Parsed<WebToplevel> parseTypeDeclaration(TokenCursor in) {
        TokenCursor c = opt(in, reservedWord(ReservedWord.TYPE)).rest();
        Parsed<Token> name = identifier(c);
        c = token(name.rest(), TokenType.EQUALS).rest();
        Parsed<WebType> type = TypeParser.parseType(c);
        c = token(type.rest(), TokenType.SEMICOLON).rest();
        Parsed<Token> comment = opt(c, Combinators::comment);
        return new Parsed<>(comment.rest(), new TypeDeclaration(name.value(), type.value(), comment.value()));
    }

    // ========================================================================
    // Procedures and functions
    // ========================================================================

    public static Parsed<WebToplevel> parseForwardDeclaration(TokenCursor in) {
        Parsed<ForwardDeclaration> decl = parseForwardDeclarationBase(in);
        return new Parsed<>(decl.rest(), decl.value());
    }

    static Parsed<ForwardDeclaration> parseForwardDeclarationBase(TokenCursor in) {
        Parsed<FunctionHeader> header = functionHeader(in);
        TokenCursor c = token(header.rest(), TokenType.SEMICOLON).rest();
        c = forwardWord(c).rest();
        c = token(c, TokenType.SEMICOLON).rest();
        Parsed<Token> comment = opt(c, Combinators::comment);
        return new Parsed<>(comment.rest(), new ForwardDeclaration(header.value(), comment.value()));
    }

    private static Parsed<Token> forwardWord(TokenCursor in) {
        Token t = in.peek();
        if (t.isReserved(ReservedWord.FORWARD) || (t.is(TokenType.IDENTIFIER) && t.text().equals("forward"))) {
            return new Parsed<>(in.advance(), t);
        }
        throw new ExpectedTokenException(ParseErrorKind.EXPECTED_RESERVED_WORD, in);
    }

    public static Parsed<WebToplevel> parseFunctionDefinition(TokenCursor in) {
        Parsed<FunctionDefinition> def = parseFunctionDefinitionBase(in);
        return new Parsed<>(def.rest(), def.value());
    }

    static Parsed<FunctionDefinition> parseFunctionDefinitionBase(TokenCursor in) {
        Parsed<FunctionHeader> header = functionHeader(in);
        TokenCursor c = token(header.rest(), TokenType.SEMICOLON).rest();
        Parsed<Token> comment = opt(c, Combinators::comment);
        Parsed<List<List<WebToplevel>>> locals = many0(comment.rest(), DeclarationParser::localDeclarations);
        Parsed<Block> body = StatementParser.parseBlock(locals.rest());

        List<WebToplevel> flat = new ArrayList<>();
        locals.value().forEach(flat::addAll);

        return new Parsed<>(body.rest(), new FunctionDefinition(header.value(), comment.value(), flat, body.value()));
    }

    private static Parsed<List<WebToplevel>> localDeclarations(TokenCursor in) {
        return Combinators.<List<WebToplevel>>alt(in,
            c -> single(parseLabelDeclaration(c)),
            c -> single(parseModulifiedDeclaration(c)),
            c -> {
                TokenCursor next = reservedWord(c, ReservedWord.VAR).rest();
                Parsed<List<VarDeclaration>> decls = many1(next, DeclarationParser::parseVarDeclarationBase);
                return new Parsed<List<WebToplevel>>(decls.rest(), new ArrayList<>(decls.value()));
            },
            c -> {
                TokenCursor next = reservedWord(c, ReservedWord.CONST).rest();
                Parsed<List<ConstDeclaration>> decls = many1(next, DeclarationParser::constDeclarationBase);
                return new Parsed<List<WebToplevel>>(decls.rest(), new ArrayList<>(decls.value()));
            });
    }

    private static Parsed<List<WebToplevel>> single(Parsed<WebToplevel> p) {
        return new Parsed<>(p.rest(), List.of(p.value()));
    }

    private static Parsed<FunctionHeader> functionHeader(TokenCursor in) {
        Parsed<Token> kind = Combinators.<Token>alt(in,
            reservedWord(ReservedWord.PROCEDURE),
            reservedWord(ReservedWord.FUNCTION));
        Parsed<Token> name = identifier(kind.rest());
        TokenCursor c = name.rest();

        List<ParameterGroup> params = List.of();
        if (!c.isAtEnd() && c.peek().isOpen(DelimiterKind.PAREN)) {
            TokenCursor p = openDelimiter(c, DelimiterKind.PAREN).rest();
            Parsed<List<ParameterGroup>> groups = separatedList1(p, TokenType.SEMICOLON, DeclarationParser::parameterGroup);
            c = closeDelimiter(groups.rest(), DelimiterKind.PAREN).rest();
            params = groups.value();
        }

        WebType returnType = null;
        if (!c.isAtEnd() && c.peek().is(TokenType.COLON)) {
            Parsed<WebType> type = TypeParser.parseType(c.advance());
            returnType = type.value();
            c = type.rest();
        }

        return new Parsed<>(c, new FunctionHeader(kind.value(), name.value(), params, returnType));
    }

    private static Parsed<ParameterGroup> parameterGroup(TokenCursor in) {
        Parsed<Token> varWord = opt(in, reservedWord(ReservedWord.VAR));
        Parsed<List<Token>> names = separatedList1(varWord.rest(), TokenType.COMMA, Combinators::identifier);
        TokenCursor c = token(names.rest(), TokenType.COLON).rest();
        Parsed<WebType> type = TypeParser.parseType(c);
        return new Parsed<>(type.rest(), new ParameterGroup(varWord.value(), names.value(), type.value()));
    }
}
