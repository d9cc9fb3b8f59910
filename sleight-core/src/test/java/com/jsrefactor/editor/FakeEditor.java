package com.jsrefactor.editor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * In-memory editor. Prompts are answered with the configured choice index,
 * or dismissed when it is negative.
 */
public class FakeEditor implements Editor {
    private String code;
    private Selection selection;
    private Position cursor;
    private int choiceIndex = 0;
    private final List<List<String>> prompts = new ArrayList<>();
    private final List<ErrorReason> errors = new ArrayList<>();

    public FakeEditor(String code, Selection selection) {
        this.code = code;
        this.selection = selection;
    }

    public FakeEditor answering(int choiceIndex) {
        this.choiceIndex = choiceIndex;
        return this;
    }

    @Override
    public String code() {
        return code;
    }

    @Override
    public Selection selection() {
        return selection;
    }

    @Override
    public CompletableFuture<Void> write(String code) {
        this.code = code;
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> write(String code, Position cursor) {
        this.code = code;
        this.cursor = cursor;
        this.selection = Selection.cursorAtPosition(cursor);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public <T> CompletableFuture<Optional<Choice<T>>> askUser(List<Choice<T>> choices) {
        prompts.add(choices.stream().map(Choice::label).toList());
        if (choiceIndex < 0) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        return CompletableFuture.completedFuture(Optional.of(choices.get(choiceIndex)));
    }

    @Override
    public void showError(ErrorReason reason) {
        errors.add(reason);
    }

    public Position cursor() {
        return cursor;
    }

    public List<List<String>> prompts() {
        return prompts;
    }

    public List<ErrorReason> errors() {
        return errors;
    }
}
