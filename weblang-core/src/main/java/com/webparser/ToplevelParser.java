package com.webparser;

import com.webparser.ast.Standalone;
import com.webparser.ast.StatementToplevel;
import com.webparser.ast.WebStatement;
import com.webparser.ast.WebToplevel;

import static com.webparser.Combinators.anyToken;
import static com.webparser.Combinators.opt;

/**
 * The toplevel dispatcher: definitions and declarations first, then the
 * special forms, then a plain statement, and finally any single token.
 */
public final class ToplevelParser {

    private ToplevelParser() {
    }

    public static Parsed<WebToplevel> parseToplevel(TokenCursor in) {
        return Combinators.<WebToplevel>alt(in,
            DeclarationParser::parseDefine,
            DeclarationParser::parseFormat,
            DeclarationParser::parseProgram,
            DeclarationParser::parseLabelDeclaration,
            DeclarationParser::parseModulifiedDeclaration,
            DeclarationParser::parseForwardDeclaration,
            DeclarationParser::parseFunctionDefinition,
            DeclarationParser::parseConstDeclaration,
            DeclarationParser::parseVarDeclaration,
            DeclarationParser::parseTypeDeclaration,
            SpecialFormParser::parseSpecial,
            ToplevelParser::statement,
            ToplevelParser::standalone);
    }

    private static Parsed<WebToplevel> statement(TokenCursor in) {
        Parsed<WebStatement> stmt = StatementParser.parseStatement(in);
        Parsed<Token> comment = opt(stmt.rest(), Combinators::comment);
        return new Parsed<>(comment.rest(), new StatementToplevel(stmt.value(), comment.value()));
    }

    private static Parsed<WebToplevel> standalone(TokenCursor in) {
        Parsed<Token> token = anyToken(in);
        Parsed<Token> comment = opt(token.rest(), Combinators::comment);
        return new Parsed<>(comment.rest(), new Standalone(token.value(), comment.value()));
    }
}
