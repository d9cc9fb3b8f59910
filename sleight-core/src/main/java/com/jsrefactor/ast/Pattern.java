package com.jsrefactor.ast;

/**
 * Binding targets of a variable declarator.
 */
public sealed interface Pattern extends Node permits
    Identifier,
    ObjectPattern {
}
