package com.jsrefactor.ast;

public record VariableDeclarator(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Pattern id,
    Expression init  // Can be null
) implements Node {
    public VariableDeclarator(Pattern id, Expression init) {
        this(0, 0, 0, 0, 0, 0, id, init);
    }

    @Override
    public String type() {
        return "VariableDeclarator";
    }
}
