package com.webparser.ast;

import com.webparser.Token;
import com.webparser.prettify.Prettifier;

import java.util.Locale;

public record BuiltinType(Token name, Kind kind) implements WebType {

    public enum Kind {
        INTEGER,
        REAL,
        BOOLEAN;

        public String pascalName() {
            return name().toLowerCase(Locale.ROOT);
        }

        /**
         * @return the builtin kind named by {@code text}, or null
         */
        public static Kind lookup(String text) {
            for (Kind k : values()) {
                if (k.pascalName().equals(text)) {
                    return k;
                }
            }
            return null;
        }
    }

    @Override
    public int measureInline() {
        return kind.pascalName().length();
    }

    @Override
    public void renderInline(Prettifier dest) {
        dest.noscopePush(kind.pascalName());
    }
}
