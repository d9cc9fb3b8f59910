package com.jsrefactor;

/**
 * Thrown when the source text is outside the supported JavaScript subset or
 * is not valid JavaScript.
 */
public class ParseException extends RuntimeException {
    private final int line;
    private final int column;

    public ParseException(String message, int line, int column) {
        super(message + " (line " + line + ", column " + column + ")");
        this.line = line;
        this.column = column;
    }

    public ParseException(String message, Token token) {
        this(message + (token.type() == TokenType.EOF ? " but reached end of input" : " but found '" + token.lexeme() + "'"),
            token.line(), token.column());
    }

    /**
     * 1-based line of the offending input.
     */
    public int line() {
        return line;
    }

    /**
     * 0-based column of the offending input.
     */
    public int column() {
        return column;
    }
}
