package com.jsrefactor.ast;

import java.util.List;

public record TemplateLiteral(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    List<Expression> expressions,
    List<TemplateElement> quasis  // always one more than expressions
) implements Expression {
    public TemplateLiteral(List<Expression> expressions, List<TemplateElement> quasis) {
        this(0, 0, 0, 0, 0, 0, expressions, quasis);
    }

    @Override
    public String type() {
        return "TemplateLiteral";
    }
}
