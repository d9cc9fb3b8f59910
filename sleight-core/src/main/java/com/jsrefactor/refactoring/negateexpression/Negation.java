package com.jsrefactor.refactoring.negateexpression;

import com.jsrefactor.ast.BinaryExpression;
import com.jsrefactor.ast.Expression;
import com.jsrefactor.ast.LogicalExpression;
import com.jsrefactor.ast.UnaryExpression;

import java.util.Map;

/**
 * Logical negation of expressions, keeping the result readable: comparison
 * operators are flipped, De Morgan's laws are applied to {@code &&} and
 * {@code ||}, and an existing {@code !} is dropped.
 */
public final class Negation {
    private static final Map<String, String> NEGATED_OPERATORS = Map.ofEntries(
        Map.entry("==", "!="),
        Map.entry("!=", "=="),
        Map.entry("===", "!=="),
        Map.entry("!==", "==="),
        Map.entry("<", ">="),
        Map.entry(">=", "<"),
        Map.entry(">", "<="),
        Map.entry("<=", ">"),
        Map.entry("&&", "||"),
        Map.entry("||", "&&")
    );

    private Negation() {
    }

    public static Expression negate(Expression expression) {
        if (expression instanceof UnaryExpression unary && unary.operator().equals("!")) {
            return unary.argument();
        }
        if (expression instanceof BinaryExpression binary && NEGATED_OPERATORS.containsKey(binary.operator())) {
            return new BinaryExpression(negatedOperator(binary.operator()), binary.left(), binary.right());
        }
        if (expression instanceof LogicalExpression logical && NEGATED_OPERATORS.containsKey(logical.operator())) {
            return new LogicalExpression(negatedOperator(logical.operator()), negate(logical.left()), negate(logical.right()));
        }
        return new UnaryExpression("!", expression);
    }

    /**
     * Whether the expression has an operator that can be negated in place.
     */
    public static boolean isNegatable(Expression expression) {
        if (expression instanceof BinaryExpression binary) {
            return NEGATED_OPERATORS.containsKey(binary.operator());
        }
        if (expression instanceof LogicalExpression logical) {
            return NEGATED_OPERATORS.containsKey(logical.operator());
        }
        return false;
    }

    /**
     * Negated form of a comparison or logical operator, or null.
     */
    public static String negatedOperator(String operator) {
        return NEGATED_OPERATORS.get(operator);
    }
}
