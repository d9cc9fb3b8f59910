package com.jsrefactor.ast;

public record AssignmentExpression(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    String operator,
    Expression left,  // Identifier or MemberExpression
    Expression right
) implements Expression {
    public AssignmentExpression(String operator, Expression left, Expression right) {
        this(0, 0, 0, 0, 0, 0, operator, left, right);
    }

    @Override
    public String type() {
        return "AssignmentExpression";
    }
}
