package com.jsrefactor.ast;

public record BreakStatement(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol
) implements Statement {
    public BreakStatement() {
        this(0, 0, 0, 0, 0, 0);
    }

    @Override
    public String type() {
        return "BreakStatement";
    }
}
