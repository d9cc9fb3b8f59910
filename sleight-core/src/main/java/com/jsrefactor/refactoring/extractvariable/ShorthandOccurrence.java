package com.jsrefactor.refactoring.extractvariable;

import com.jsrefactor.editor.Modification;
import com.jsrefactor.editor.Position;
import com.jsrefactor.editor.Selection;
import com.jsrefactor.traverse.NodePath;

/**
 * The value of {@code { key: value }}, extracted as {@code key} so the
 * property collapses to {@code { key }}.
 *
 * @param keySelection range of the property key
 */
public record ShorthandOccurrence(
    NodePath path,
    Selection selection,
    String code,
    Variable variable,
    Selection keySelection
) implements Occurrence {

    // Drops ": value", leaving the key
    @Override
    public Modification modification() {
        return new Modification("", selection.extendStartToEndOf(keySelection));
    }

    @Override
    public Position extractedIdPosition() {
        return new Position(selection.start().line() + selection.height() + 1, keySelection.end().character());
    }
}
