package com.jsrefactor.refactoring.extractvariable;

import com.jsrefactor.editor.Position;
import com.jsrefactor.editor.Selection;

import java.util.Optional;

/**
 * A template quasi's source text split around the user's selection.
 */
record Parts(String before, String selected, String after) {

    /**
     * @param offset position of the first character of {@code text}
     * @return empty unless the selection is a single-line range within the text
     */
    static Optional<Parts> of(String text, Selection selection, Position offset) {
        if (selection.isMultiLines() || selection.start().line() != offset.line()) {
            return Optional.empty();
        }
        int from = selection.start().character() - offset.character();
        int to = selection.end().character() - offset.character();
        if (from < 0 || to > text.length() || from >= to) {
            return Optional.empty();
        }
        return Optional.of(new Parts(text.substring(0, from), text.substring(from, to), text.substring(to)));
    }
}
