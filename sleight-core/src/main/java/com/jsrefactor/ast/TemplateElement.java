package com.jsrefactor.ast;

/**
 * A quasi: the literal text between the backticks and the substitutions.
 * Its range excludes the delimiters ({@code `}, <code>${</code> and {@code }}).
 */
public record TemplateElement(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    TemplateElementValue value,
    boolean tail
) implements Node {
    public TemplateElement(String raw, boolean tail) {
        this(0, 0, 0, 0, 0, 0, new TemplateElementValue(raw, raw), tail);
    }

    @Override
    public String type() {
        return "TemplateElement";
    }

    public record TemplateElementValue(
        String raw,
        String cooked
    ) {}
}
