package com.jsrefactor;

/**
 * A lexed token. Lines are 1-based, columns 0-based; positions are offsets
 * into the source, end exclusive.
 *
 * @param literal cooked value for strings and templates, Double for numbers
 * @param raw     source text between template delimiters, null otherwise
 */
public record Token(
    TokenType type,
    String lexeme,
    Object literal,
    String raw,
    int line,
    int column,
    int endLine,
    int endColumn,
    int position,
    int endPosition
) {
}
