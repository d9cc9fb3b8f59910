package com.jsrefactor.config;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class RefactoringConfigTest {

    @Test
    void testDefaults() {
        RefactoringConfig config = RefactoringConfig.defaults();

        assertEquals(2, config.indentSize());
        assertEquals("const", config.declarationKeyword());
        assertEquals("extracted", config.defaultVariableName());
        assertEquals(20, config.maxVariableNameLength());
        assertEquals(List.of("==="), config.equalityOperators());
    }

    @Test
    void testWithers() {
        RefactoringConfig config = RefactoringConfig.defaults()
            .withIndentSize(4)
            .withDeclarationKeyword("let")
            .withEqualityOperators(List.of("==", "==="));

        assertEquals(4, config.indentSize());
        assertEquals("let", config.declarationKeyword());
        assertEquals(List.of("==", "==="), config.equalityOperators());
    }

    @Test
    void testOperatorsAreCopied() {
        List<String> operators = new ArrayList<>(List.of("==="));
        RefactoringConfig config = RefactoringConfig.defaults().withEqualityOperators(operators);
        operators.add("==");

        assertEquals(List.of("==="), config.equalityOperators());
        assertThrows(UnsupportedOperationException.class, () -> config.equalityOperators().add("=="));
    }

    @Test
    void testValidation() {
        RefactoringConfig defaults = RefactoringConfig.defaults();

        assertThrows(IllegalArgumentException.class, () -> defaults.withIndentSize(-1));
        assertThrows(IllegalArgumentException.class, () -> defaults.withDeclarationKeyword("val"));
        assertThrows(IllegalArgumentException.class, () -> defaults.withEqualityOperators(List.of()));
        assertThrows(IllegalArgumentException.class, () -> defaults.withEqualityOperators(List.of("!==")));
        assertThrows(IllegalArgumentException.class, () -> new RefactoringConfig(2, "const", "x", 0, List.of("===")));
    }
}
