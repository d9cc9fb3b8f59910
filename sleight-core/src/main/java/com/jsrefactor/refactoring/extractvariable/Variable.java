package com.jsrefactor.refactoring.extractvariable;

import com.jsrefactor.ast.Node;
import com.jsrefactor.ast.Nodes;
import com.jsrefactor.ast.MemberExpression;
import com.jsrefactor.ast.Identifier;
import com.jsrefactor.ast.Property;
import com.jsrefactor.config.RefactoringConfig;

/**
 * The name an extracted value is bound to.
 *
 * @param valid false when the name cannot serve the occurrence it was
 *              derived for, e.g. a shorthand property with no usable key
 */
public record Variable(String name, boolean valid) {

    /**
     * Text inserted where the extracted expression was.
     */
    public String id() {
        return name;
    }

    public int length() {
        return name.length();
    }

    /**
     * Property name for a non-computed member access, key name for the value
     * of an identifier-keyed property, the default name otherwise.
     */
    public static Variable forNode(Node node, Node parent, RefactoringConfig config) {
        if (Nodes.isNonComputedMember(node)) {
            String property = ((Identifier) ((MemberExpression) node).property()).name();
            if (Identifiers.isValid(property)) {
                return new Variable(property, true);
            }
        }
        if (parent instanceof Property property && property.value() == node) {
            String key = Nodes.identifierKey(property);
            if (Identifiers.isValid(key)) {
                return new Variable(key, true);
            }
        }
        return new Variable(config.defaultVariableName(), true);
    }

    /**
     * camelCase of the string's words when that is a usable, short enough
     * name; otherwise as {@link #forNode}.
     */
    public static Variable forStringLiteral(String value, Node node, Node parent, RefactoringConfig config) {
        String camelCased = Identifiers.camelCase(value);
        if (Identifiers.isValid(camelCased) && camelCased.length() <= config.maxVariableNameLength()) {
            return new Variable(camelCased, true);
        }
        return forNode(node, parent, config);
    }

    /**
     * The key of the property whose value is {@code node}; valid only when
     * the key can be written in shorthand form.
     */
    public static Variable forShorthand(Node node, Node parent, RefactoringConfig config) {
        if (parent instanceof Property property && property.value() == node && !property.shorthand()) {
            String key = Nodes.identifierKey(property);
            if (Identifiers.isValid(key)) {
                return new Variable(key, true);
            }
        }
        return new Variable(config.defaultVariableName(), false);
    }
}
