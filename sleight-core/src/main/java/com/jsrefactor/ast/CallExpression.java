package com.jsrefactor.ast;

import java.util.List;

public record CallExpression(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Expression callee,
    List<Expression> arguments
) implements Expression {
    public CallExpression(Expression callee, List<Expression> arguments) {
        this(0, 0, 0, 0, 0, 0, callee, arguments);
    }

    @Override
    public String type() {
        return "CallExpression";
    }
}
