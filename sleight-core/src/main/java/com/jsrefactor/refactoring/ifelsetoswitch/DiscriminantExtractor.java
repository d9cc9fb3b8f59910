package com.jsrefactor.refactoring.ifelsetoswitch;

import com.jsrefactor.ast.Expression;

import java.util.Optional;

/**
 * Decomposes an if-test into a switch discriminant and case value.
 */
@FunctionalInterface
public interface DiscriminantExtractor {

    /**
     * Empty when the test cannot be expressed as a switch case.
     */
    Optional<SwitchTest> extract(Expression test);
}
