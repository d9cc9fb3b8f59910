package com.jsrefactor.json;

/**
 * Thrown when converting between JSON and AST nodes or configuration fails.
 */
public class AstJsonException extends RuntimeException {

    public AstJsonException(String message) {
        super(message);
    }

    public AstJsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
