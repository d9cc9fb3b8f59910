package com.jsrefactor.editor;

/**
 * An option offered to the user: what they read and what the refactoring
 * gets back.
 */
public record Choice<T>(String label, T value) {
}
