package com.jsrefactor.ast;

import java.util.List;

public record ArrayExpression(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    List<Expression> elements
) implements Expression {
    public ArrayExpression(List<Expression> elements) {
        this(0, 0, 0, 0, 0, 0, elements);
    }

    @Override
    public String type() {
        return "ArrayExpression";
    }
}
