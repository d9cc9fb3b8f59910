package com.jsrefactor.refactoring.extractvariable;

import com.jsrefactor.editor.Selection;
import com.jsrefactor.traverse.NodePath;

public record GenericOccurrence(
    NodePath path,
    Selection selection,
    String code,
    Variable variable
) implements Occurrence {
}
