package com.jsrefactor.ast;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.RecordComponent;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Generic access to node fields plus the small predicates and builders the
 * refactorings share.
 *
 * <p>Every node is a record whose first six components are its position. The
 * remaining components, in declaration order, are its syntactic fields.</p>
 */
public final class Nodes {

    // Position components, never part of the syntax
    static final Set<String> POSITION_FIELDS = Set.of("start", "end", "startLine", "startCol", "endLine", "endCol");

    private static final Map<Class<?>, List<RecordComponent>> FIELDS = new ConcurrentHashMap<>();

    private Nodes() {
        // Utility class
    }

    /**
     * A direct child of a node: the field it lives in, its index when that
     * field is a list (-1 otherwise), and the child itself.
     */
    public record Child(String key, int index, Node node) {}

    /**
     * Syntactic record components of a node class, in declaration order.
     */
    static List<RecordComponent> fields(Class<?> nodeClass) {
        return FIELDS.computeIfAbsent(nodeClass, cls -> Arrays.stream(cls.getRecordComponents())
            .filter(component -> !POSITION_FIELDS.contains(component.getName()))
            .toList());
    }

    static Object read(RecordComponent component, Node node) {
        try {
            return component.getAccessor().invoke(node);
        } catch (IllegalAccessException | InvocationTargetException e) {
            throw new IllegalStateException("Cannot read " + component.getName() + " of " + node.type(), e);
        }
    }

    /**
     * Direct children of a node in source field order. Null fields are skipped.
     */
    public static List<Child> children(Node node) {
        List<Child> children = new ArrayList<>();
        for (RecordComponent component : fields(node.getClass())) {
            Object value = read(component, node);
            if (value instanceof Node child) {
                children.add(new Child(component.getName(), -1, child));
            } else if (value instanceof List<?> list) {
                for (int i = 0; i < list.size(); i++) {
                    if (list.get(i) instanceof Node child) {
                        children.add(new Child(component.getName(), i, child));
                    }
                }
            }
        }
        return children;
    }

    /**
     * Literal values a switch case can dispatch on: plain literals and
     * templates without substitutions.
     */
    public static boolean isLiteral(Node node) {
        if (node instanceof Literal) {
            return true;
        }
        return node instanceof TemplateLiteral template && template.expressions().isEmpty();
    }

    /**
     * Statements of a branch body: the block contents, or the single statement.
     */
    public static List<Statement> getStatements(Statement statement) {
        if (statement instanceof BlockStatement block) {
            return block.body();
        }
        return List.of(statement);
    }

    public static boolean hasFinalReturn(List<Statement> statements) {
        return !statements.isEmpty() && statements.get(statements.size() - 1) instanceof ReturnStatement;
    }

    public static boolean isNonComputedMember(Node node) {
        return node instanceof MemberExpression member
            && !member.computed()
            && member.property() instanceof Identifier;
    }

    /**
     * Name of a non-computed identifier key, or null.
     */
    public static String identifierKey(Property property) {
        if (property.computed() || !(property.key() instanceof Identifier key)) {
            return null;
        }
        return key.name();
    }

    /**
     * Double-quoted JavaScript source for a string value.
     */
    public static String quote(String value) {
        StringBuilder sb = new StringBuilder("\"");
        for (char c : value.toCharArray()) {
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }
}
