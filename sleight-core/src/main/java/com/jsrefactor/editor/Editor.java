package com.jsrefactor.editor;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * The host editor as seen by a refactoring.
 */
public interface Editor {

    String code();

    Selection selection();

    /**
     * Replaces the whole document.
     */
    CompletableFuture<Void> write(String code);

    /**
     * Replaces the whole document and moves the cursor.
     */
    CompletableFuture<Void> write(String code, Position cursor);

    /**
     * Completes with the user's pick, or empty when they dismiss the prompt.
     */
    <T> CompletableFuture<Optional<Choice<T>>> askUser(List<Choice<T>> choices);

    void showError(ErrorReason reason);
}
