package com.jsrefactor.ast;

public record EmptyStatement(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol
) implements Statement {
    public EmptyStatement() {
        this(0, 0, 0, 0, 0, 0);
    }

    @Override
    public String type() {
        return "EmptyStatement";
    }
}
