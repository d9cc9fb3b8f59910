package com.jsrefactor.ast;

import java.util.List;

public record Program(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    List<Statement> body
) implements Node {
    public Program(List<Statement> body) {
        this(0, 0, 0, 0, 0, 0, body);
    }

    @Override
    public String type() {
        return "Program";
    }
}
