package com.jsrefactor.ast;

public record ConditionalExpression(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Expression test,
    Expression consequent,
    Expression alternate
) implements Expression {
    public ConditionalExpression(Expression test, Expression consequent, Expression alternate) {
        this(0, 0, 0, 0, 0, 0, test, consequent, alternate);
    }

    @Override
    public String type() {
        return "ConditionalExpression";
    }
}
