package com.jsrefactor.ast;

public record UnaryExpression(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    String operator,
    Expression argument
) implements Expression {
    public UnaryExpression(String operator, Expression argument) {
        this(0, 0, 0, 0, 0, 0, operator, argument);
    }

    @Override
    public String type() {
        return "UnaryExpression";
    }
}
