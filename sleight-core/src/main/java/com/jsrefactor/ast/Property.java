package com.jsrefactor.ast;

public record Property(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    boolean shorthand,
    boolean computed,
    Node key,
    Node value,  // Expression in object literals, Pattern in object patterns
    String kind
) implements Node {
    public Property(Node key, Node value, boolean computed, boolean shorthand) {
        this(0, 0, 0, 0, 0, 0, shorthand, computed, key, value, "init");
    }

    @Override
    public String type() {
        return "Property";
    }
}
