package com.jsrefactor.editor;

/**
 * Replace the text under {@code selection} with {@code code}. An empty
 * selection inserts.
 */
public record Modification(String code, Selection selection) {
}
