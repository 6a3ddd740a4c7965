package com.webparser.prettify;

/**
 * A push or pop of a style scope at a text offset.
 */
public record ScopeOp(int offset, Kind kind, Scope scope) {

    public enum Kind {
        PUSH,
        POP
    }

    public static ScopeOp push(int offset, Scope scope) {
        return new ScopeOp(offset, Kind.PUSH, scope);
    }

    public static ScopeOp pop(int offset) {
        return new ScopeOp(offset, Kind.POP, null);
    }
}
