package com.jsrefactor.ast;

public record ThrowStatement(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Expression argument
) implements Statement {
    public ThrowStatement(Expression argument) {
        this(0, 0, 0, 0, 0, 0, argument);
    }

    @Override
    public String type() {
        return "ThrowStatement";
    }
}
