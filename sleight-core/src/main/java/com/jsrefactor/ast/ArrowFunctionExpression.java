package com.jsrefactor.ast;

import java.util.List;

public record ArrowFunctionExpression(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    List<Identifier> params,
    Node body,  // BlockStatement or Expression
    boolean expression  // true when body is an expression
) implements Expression {
    public ArrowFunctionExpression(List<Identifier> params, Node body, boolean expression) {
        this(0, 0, 0, 0, 0, 0, params, body, expression);
    }

    @Override
    public String type() {
        return "ArrowFunctionExpression";
    }
}
