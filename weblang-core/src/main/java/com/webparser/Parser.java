package com.webparser;

import com.webparser.ast.Empty;
import com.webparser.ast.WebCode;
import com.webparser.ast.WebToplevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Parses the token list of one WEB code section into a {@link WebCode} tree.
 *
 * <p>The parser holds no state; one instance may be shared freely.</p>
 */
public class Parser {
    private static final Logger log = LoggerFactory.getLogger(Parser.class);

    static final int CONTEXT_TOKENS = 8;

    /**
     * Parse the whole token list.
     *
     * @throws ParseException if some tokens could not be consumed
     */
    public WebCode parse(List<Token> tokens) {
        TokenCursor start = TokenCursor.start(tokens);

        if (start.isAtEnd()) {
            return new WebCode(List.of(new Empty()));
        }

        Parsed<List<WebToplevel>> result;
        try {
            result = Combinators.many1(start, ToplevelParser::parseToplevel);
        } catch (ExpectedTokenException e) {
            throw failure(e.kind(), start);
        }

        if (!result.rest().isAtEnd()) {
            throw failure(ParseErrorKind.NO_ALTERNATIVE, result.rest());
        }

        log.debug("Parsed {} tokens into {} toplevels", tokens.size(), result.value().size());
        return new WebCode(result.value());
    }

    /**
     * Like {@link #parse(List)}, but reports failure as an empty result.
     */
    public Optional<WebCode> tryParse(List<Token> tokens) {
        try {
            return Optional.of(parse(tokens));
        } catch (ParseException e) {
            return Optional.empty();
        }
    }

    private ParseException failure(ParseErrorKind kind, TokenCursor at) {
        List<Token> context = at.context(CONTEXT_TOKENS);
        log.debug("Parse failed ({}) at token {}: {}", kind, at.position(), context);
        return new ParseException(kind, at.position(), context);
    }
}
