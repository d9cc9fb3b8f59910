package com.jsrefactor.config;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Knobs shared by all refactorings.
 *
 * @param indentSize            spaces per indentation level in generated code
 * @param declarationKeyword    keyword of extracted variable declarations
 * @param defaultVariableName   name used when no better one can be derived
 * @param maxVariableNameLength longest name derived from a string value
 * @param equalityOperators     operators recognised as case tests by the
 *                              if/else to switch conversion. A switch always
 *                              compares with {@code ===}, so allowing
 *                              {@code ==} changes behaviour for operands
 *                              that only match loosely: {@code x == 1} holds
 *                              for {@code "1"} but {@code case 1:} does not
 */
public record RefactoringConfig(
    int indentSize,
    String declarationKeyword,
    String defaultVariableName,
    int maxVariableNameLength,
    List<String> equalityOperators
) {
    private static final Set<String> DECLARATION_KEYWORDS = Set.of("const", "let", "var");
    private static final Set<String> EQUALITY_OPERATORS = Set.of("===", "==");

    public RefactoringConfig {
        if (indentSize < 0) {
            throw new IllegalArgumentException("indentSize must not be negative: " + indentSize);
        }
        if (!DECLARATION_KEYWORDS.contains(declarationKeyword)) {
            throw new IllegalArgumentException("declarationKeyword must be one of " + DECLARATION_KEYWORDS + ": " + declarationKeyword);
        }
        Objects.requireNonNull(defaultVariableName, "defaultVariableName");
        if (maxVariableNameLength < 1) {
            throw new IllegalArgumentException("maxVariableNameLength must be positive: " + maxVariableNameLength);
        }
        Objects.requireNonNull(equalityOperators, "equalityOperators");
        if (equalityOperators.isEmpty() || !EQUALITY_OPERATORS.containsAll(equalityOperators)) {
            throw new IllegalArgumentException("equalityOperators must be a non-empty subset of " + EQUALITY_OPERATORS + ": " + equalityOperators);
        }
        equalityOperators = List.copyOf(equalityOperators);
    }

    public static RefactoringConfig defaults() {
        return new RefactoringConfig(2, "const", "extracted", 20, List.of("==="));
    }

    public RefactoringConfig withIndentSize(int indentSize) {
        return new RefactoringConfig(indentSize, declarationKeyword, defaultVariableName, maxVariableNameLength, equalityOperators);
    }

    public RefactoringConfig withDeclarationKeyword(String declarationKeyword) {
        return new RefactoringConfig(indentSize, declarationKeyword, defaultVariableName, maxVariableNameLength, equalityOperators);
    }

    /**
     * Including {@code ==} trades exactness for reach: the converted switch
     * compares strictly, so values like {@code "1"} and {@code 1} stop matching.
     */
    public RefactoringConfig withEqualityOperators(List<String> equalityOperators) {
        return new RefactoringConfig(indentSize, declarationKeyword, defaultVariableName, maxVariableNameLength, equalityOperators);
    }
}
