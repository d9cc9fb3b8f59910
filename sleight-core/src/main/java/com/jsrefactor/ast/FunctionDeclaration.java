package com.jsrefactor.ast;

import java.util.List;

public record FunctionDeclaration(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Identifier id,
    List<Identifier> params,
    BlockStatement body
) implements Statement {
    public FunctionDeclaration(Identifier id, List<Identifier> params, BlockStatement body) {
        this(0, 0, 0, 0, 0, 0, id, params, body);
    }

    @Override
    public String type() {
        return "FunctionDeclaration";
    }
}
