package com.jsrefactor.ast;

import java.util.List;

public record SwitchCase(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Expression test,  // null for default case
    List<Statement> consequent
) implements Node {
    public SwitchCase(Expression test, List<Statement> consequent) {
        this(0, 0, 0, 0, 0, 0, test, consequent);
    }

    @Override
    public String type() {
        return "SwitchCase";
    }
}
