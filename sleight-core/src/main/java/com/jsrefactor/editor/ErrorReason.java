package com.jsrefactor.editor;

public enum ErrorReason {
    DID_NOT_PARSE_CODE("I couldn't parse the code, so I can't refactor it"),
    DID_NOT_FIND_IF_ELSE_TO_CONVERT("I didn't find a valid if/else to convert to a switch"),
    DID_NOT_FIND_EXTRACTABLE_CODE("I didn't find a valid code to extract"),
    DID_NOT_FIND_SWITCH_TO_CONVERT("I didn't find a valid switch to convert to if/else"),
    DID_NOT_FIND_TERNARY_TO_FLIP("I didn't find a ternary to flip"),
    DID_NOT_FIND_NEGATABLE_EXPRESSION("I didn't find a valid expression to negate");

    private final String message;

    ErrorReason(String message) {
        this.message = message;
    }

    public String message() {
        return message;
    }
}
