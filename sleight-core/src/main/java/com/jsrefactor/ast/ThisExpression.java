package com.jsrefactor.ast;

public record ThisExpression(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol
) implements Expression {
    public ThisExpression() {
        this(0, 0, 0, 0, 0, 0);
    }

    @Override
    public String type() {
        return "ThisExpression";
    }
}
