package com.webparser.prettify;

public record PositionedInsert(int offset, TexInsert insert) {
}
