package com.jsrefactor.refactoring.extractvariable;

/**
 * How a property access is extracted: {@code const { name } = obj} or
 * {@code const name = obj.name}.
 */
public enum DestructureStrategy {
    DESTRUCTURE,
    PRESERVE
}
