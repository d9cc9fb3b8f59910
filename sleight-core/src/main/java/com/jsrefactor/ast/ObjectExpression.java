package com.jsrefactor.ast;

import java.util.List;

public record ObjectExpression(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    List<Property> properties
) implements Expression {
    public ObjectExpression(List<Property> properties) {
        this(0, 0, 0, 0, 0, 0, properties);
    }

    @Override
    public String type() {
        return "ObjectExpression";
    }
}
