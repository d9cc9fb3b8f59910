package com.jsrefactor.refactoring.extractvariable;

import com.jsrefactor.editor.Selection;
import com.jsrefactor.traverse.NodePath;

/**
 * A whole string literal, named after its words.
 */
public record StringLiteralOccurrence(
    NodePath path,
    Selection selection,
    String code,
    Variable variable
) implements Occurrence {
}
