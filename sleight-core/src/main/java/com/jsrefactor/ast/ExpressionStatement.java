package com.jsrefactor.ast;

public record ExpressionStatement(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Expression expression
) implements Statement {
    public ExpressionStatement(Expression expression) {
        this(0, 0, 0, 0, 0, 0, expression);
    }

    @Override
    public String type() {
        return "ExpressionStatement";
    }
}
