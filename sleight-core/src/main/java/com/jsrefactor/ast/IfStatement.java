package com.jsrefactor.ast;

public record IfStatement(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Expression test,
    Statement consequent,
    Statement alternate  // Can be null
) implements Statement {
    public IfStatement(Expression test, Statement consequent, Statement alternate) {
        this(0, 0, 0, 0, 0, 0, test, consequent, alternate);
    }

    @Override
    public String type() {
        return "IfStatement";
    }
}
