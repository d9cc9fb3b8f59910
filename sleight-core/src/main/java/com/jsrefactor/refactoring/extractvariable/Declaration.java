package com.jsrefactor.refactoring.extractvariable;

/**
 * Left and right side of the declaration introducing the extracted value.
 * The name may be a destructuring pattern such as {@code { value }}.
 */
public record Declaration(String name, String value) {

    public String toCode(String keyword) {
        return keyword + " " + name + " = " + value + ";";
    }
}
