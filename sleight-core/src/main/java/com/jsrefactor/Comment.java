package com.jsrefactor;

/**
 * A comment as written in the source, delimiters included. Positions are
 * offsets, end exclusive.
 */
public record Comment(String text, int start, int end) {

    public boolean isBlock() {
        return text.startsWith("/*");
    }
}
