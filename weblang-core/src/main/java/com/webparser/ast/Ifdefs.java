package com.webparser.ast;

import com.webparser.Token;
import com.webparser.prettify.Prettifier;

/**
 * Layout shared by the conditional-compilation wrappers: the opening tag and
 * brace, the indented body, then the closing brace.
 */
final class Ifdefs {

    private Ifdefs() {
    }

    static void open(Token begin, Prettifier dest) {
        begin.renderInline(dest);
        dest.noscopePush("!{");
        dest.indentBlock();
        dest.newlineIndent();
    }

    static void close(Prettifier dest) {
        dest.dedentBlock();
        dest.newlineIndent();
        dest.noscopePush('}');
    }
}
