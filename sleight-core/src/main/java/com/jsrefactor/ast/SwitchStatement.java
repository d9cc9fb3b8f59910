package com.jsrefactor.ast;

import java.util.List;

public record SwitchStatement(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Expression discriminant,
    List<SwitchCase> cases
) implements Statement {
    public SwitchStatement(Expression discriminant, List<SwitchCase> cases) {
        this(0, 0, 0, 0, 0, 0, discriminant, cases);
    }

    @Override
    public String type() {
        return "SwitchStatement";
    }
}
