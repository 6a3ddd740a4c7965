package com.webparser;

import com.webparser.ast.ArrayType;
import com.webparser.ast.BuiltinType;
import com.webparser.ast.PackedFileOfType;
import com.webparser.ast.PointerType;
import com.webparser.ast.RangeBound;
import com.webparser.ast.RangeType;
import com.webparser.ast.RecordField;
import com.webparser.ast.RecordType;
import com.webparser.ast.UserDefinedType;
import com.webparser.ast.WebType;

import java.util.List;

import static com.webparser.Combinators.closeDelimiter;
import static com.webparser.Combinators.identifier;
import static com.webparser.Combinators.intLiteral;
import static com.webparser.Combinators.many1;
import static com.webparser.Combinators.mergedStringLiterals;
import static com.webparser.Combinators.openDelimiter;
import static com.webparser.Combinators.opt;
import static com.webparser.Combinators.reservedWord;
import static com.webparser.Combinators.separatedList1;
import static com.webparser.Combinators.token;

/**
 * Pascal type grammar.
 */
public final class TypeParser {

    private TypeParser() {
    }

    public static Parsed<WebType> parseType(TokenCursor in) {
        return Combinators.<WebType>alt(in,
            TypeParser::builtin,
            TypeParser::pointer,
            TypeParser::packedFileOf,
            TypeParser::record,
            TypeParser::array,
            TypeParser::range,
            TypeParser::userDefined);
    }

    private static Parsed<WebType> builtin(TokenCursor in) {
        Parsed<Token> name = identifier(in);
        BuiltinType.Kind kind = BuiltinType.Kind.lookup(name.value().text());
        if (kind == null) {
            throw new ExpectedTokenException(ParseErrorKind.EXPECTED_IDENTIFIER, in);
        }
        return new Parsed<>(name.rest(), new BuiltinType(name.value(), kind));
    }

    private static Parsed<WebType> pointer(TokenCursor in) {
        TokenCursor c = token(in, TokenType.CARET).rest();
        Parsed<WebType> target = parseType(c);
        return new Parsed<>(target.rest(), new PointerType(target.value()));
    }

    private static Parsed<WebType> packedFileOf(TokenCursor in) {
        TokenCursor c = reservedWord(in, ReservedWord.PACKED).rest();
        c = reservedWord(c, ReservedWord.FILE).rest();
        c = reservedWord(c, ReservedWord.OF).rest();
        Parsed<Token> element = identifier(c);
        return new Parsed<>(element.rest(), new PackedFileOfType(element.value()));
    }

    private static Parsed<WebType> record(TokenCursor in) {
        Parsed<Token> packed = opt(in, reservedWord(ReservedWord.PACKED));
        TokenCursor c = reservedWord(packed.rest(), ReservedWord.RECORD).rest();
        Parsed<List<RecordField>> fields = many1(c, TypeParser::recordField);
        c = reservedWord(fields.rest(), ReservedWord.END).rest();
        return new Parsed<>(c, new RecordType(packed.value() != null, fields.value()));
    }

    private static Parsed<RecordField> recordField(TokenCursor in) {
        Parsed<List<Token>> names = separatedList1(in, TokenType.COMMA, Combinators::identifier);
        TokenCursor c = token(names.rest(), TokenType.COLON).rest();
        Parsed<WebType> type = parseType(c);
        c = token(type.rest(), TokenType.SEMICOLON).rest();
        Parsed<Token> comment = opt(c, Combinators::comment);
        return new Parsed<>(comment.rest(), new RecordField(names.value(), type.value(), comment.value()));
    }

    private static Parsed<WebType> array(TokenCursor in) {
        Parsed<Token> packed = opt(in, reservedWord(ReservedWord.PACKED));
        TokenCursor c = reservedWord(packed.rest(), ReservedWord.ARRAY).rest();
        c = openDelimiter(c, DelimiterKind.SQUARE_BRACKET).rest();
        Parsed<List<WebType>> axes = separatedList1(c, TokenType.COMMA, TypeParser::parseType);
        c = closeDelimiter(axes.rest(), DelimiterKind.SQUARE_BRACKET).rest();
        c = reservedWord(c, ReservedWord.OF).rest();
        Parsed<WebType> element = parseType(c);
        return new Parsed<>(element.rest(), new ArrayType(packed.value() != null, axes.value(), element.value()));
    }

    private static Parsed<WebType> range(TokenCursor in) {
        Parsed<RangeBound> from = rangeBound(in);
        TokenCursor c = token(from.rest(), TokenType.DOUBLE_DOT).rest();
        Parsed<RangeBound> to = rangeBound(c);
        return new Parsed<>(to.rest(), new RangeType(from.value(), to.value()));
    }

    private static Parsed<RangeBound> rangeBound(TokenCursor in) {
        return Combinators.<RangeBound>alt(in,
            c -> {
                Parsed<Token> t = intLiteral(c);
                return new Parsed<RangeBound>(t.rest(), new RangeBound.Literal(t.value()));
            },
            c -> {
                Parsed<Token> t = mergedStringLiterals(c);
                return new Parsed<RangeBound>(t.rest(), new RangeBound.Literal(t.value()));
            },
            c -> {
                Parsed<Token> name = identifier(c);
                Parsed<Token> op = Combinators.oneOf(name.rest(), TokenType.PLUS, TokenType.MINUS);
                Parsed<Token> offset = intLiteral(op.rest());
                return new Parsed<RangeBound>(offset.rest(),
                    new RangeBound.SymbolicOffset(name.value(), op.value(), offset.value()));
            },
            c -> {
                Parsed<Token> name = identifier(c);
                return new Parsed<RangeBound>(name.rest(), new RangeBound.Symbolic(name.value()));
            },
            c -> {
                Parsed<Token> op = Combinators.oneOf(c, TokenType.PLUS, TokenType.MINUS);
                Parsed<Token> name = identifier(op.rest());
                return new Parsed<RangeBound>(name.rest(), new RangeBound.UnarySymbolic(op.value(), name.value()));
            });
    }

    private static Parsed<WebType> userDefined(TokenCursor in) {
        Parsed<Token> name = identifier(in);
        return new Parsed<>(name.rest(), new UserDefinedType(name.value()));
    }
}
