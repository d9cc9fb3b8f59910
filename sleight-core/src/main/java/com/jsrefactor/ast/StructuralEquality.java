package com.jsrefactor.ast;

import java.lang.reflect.RecordComponent;
import java.util.List;
import java.util.Objects;

/**
 * Deep equality over syntax, ignoring positions.
 *
 * <p>Literals compare by value, so {@code 'a'} equals {@code "a"} and
 * {@code 1} equals {@code 1.0}. Template elements compare by raw text.</p>
 */
public final class StructuralEquality {

    private StructuralEquality() {
        // Utility class
    }

    public static boolean areEqual(Node a, Node b) {
        if (a == b) {
            return true;
        }
        if (a == null || b == null || a.getClass() != b.getClass()) {
            return false;
        }
        if (a instanceof Literal left) {
            return literalValuesEqual(left.value(), ((Literal) b).value());
        }
        if (a instanceof TemplateElement left) {
            return left.value().raw().equals(((TemplateElement) b).value().raw());
        }
        for (RecordComponent component : Nodes.fields(a.getClass())) {
            if (!valuesEqual(Nodes.read(component, a), Nodes.read(component, b))) {
                return false;
            }
        }
        return true;
    }

    private static boolean valuesEqual(Object a, Object b) {
        if (a instanceof Node left && b instanceof Node right) {
            return areEqual(left, right);
        }
        if (a instanceof List<?> left && b instanceof List<?> right) {
            if (left.size() != right.size()) {
                return false;
            }
            for (int i = 0; i < left.size(); i++) {
                if (!valuesEqual(left.get(i), right.get(i))) {
                    return false;
                }
            }
            return true;
        }
        return Objects.equals(a, b);
    }

    private static boolean literalValuesEqual(Object a, Object b) {
        if (a instanceof Number left && b instanceof Number right) {
            return Double.compare(left.doubleValue(), right.doubleValue()) == 0;
        }
        return Objects.equals(a, b);
    }
}
