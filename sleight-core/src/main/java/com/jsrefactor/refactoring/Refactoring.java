package com.jsrefactor.refactoring;

import com.jsrefactor.editor.Editor;
import com.jsrefactor.editor.Selection;

import java.util.concurrent.CompletableFuture;

/**
 * A selection-driven source transformation.
 */
public interface Refactoring {

    /**
     * Stable identifier, e.g. {@code convertIfElseToSwitch}.
     */
    String key();

    /**
     * Command title shown in a command palette.
     */
    String title();

    /**
     * Short label for a quick-fix menu.
     */
    String actionMessage();

    /**
     * Whether {@link #perform(Editor)} would change the code at this
     * selection. Never throws; unparsable code is not refactorable.
     */
    boolean canPerform(String code, Selection selection);

    /**
     * Reads the editor's code and selection once, then either writes the
     * refactored code or reports why it could not.
     */
    CompletableFuture<Void> perform(Editor editor);
}
