package com.jsrefactor.refactoring.ifelsetoswitch;

import com.jsrefactor.ast.BinaryExpression;
import com.jsrefactor.ast.Expression;
import com.jsrefactor.ast.Nodes;

import java.util.Optional;
import java.util.Set;

/**
 * Recognises {@code expr OP literal} and {@code literal OP expr} for the
 * configured equality operators. Literals are non-regex literals and
 * templates without substitutions.
 */
public class EqualityDiscriminantExtractor implements DiscriminantExtractor {
    private final Set<String> operators;

    public EqualityDiscriminantExtractor(Set<String> operators) {
        this.operators = Set.copyOf(operators);
    }

    @Override
    public Optional<SwitchTest> extract(Expression test) {
        if (!(test instanceof BinaryExpression binary) || !operators.contains(binary.operator())) {
            return Optional.empty();
        }
        if (Nodes.isLiteral(binary.right())) {
            return Optional.of(new SwitchTest(binary.left(), binary.right()));
        }
        if (Nodes.isLiteral(binary.left())) {
            return Optional.of(new SwitchTest(binary.right(), binary.left()));
        }
        return Optional.empty();
    }
}
