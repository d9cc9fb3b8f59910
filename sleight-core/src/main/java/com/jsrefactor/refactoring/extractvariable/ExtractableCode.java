package com.jsrefactor.refactoring.extractvariable;

import com.jsrefactor.ast.ArrowFunctionExpression;
import com.jsrefactor.ast.AssignmentExpression;
import com.jsrefactor.ast.Expression;
import com.jsrefactor.ast.FunctionDeclaration;
import com.jsrefactor.ast.MemberExpression;
import com.jsrefactor.ast.Node;
import com.jsrefactor.ast.ObjectPattern;
import com.jsrefactor.ast.Program;
import com.jsrefactor.ast.Property;
import com.jsrefactor.ast.VariableDeclarator;
import com.jsrefactor.editor.Selection;
import com.jsrefactor.traverse.NodePath;
import com.jsrefactor.traverse.Traversal;
import com.jsrefactor.traverse.TraversalControl;

import java.util.Optional;

/**
 * Finds the expression to extract: the deepest one containing the selection
 * that can be replaced by a variable without changing what the code means.
 */
final class ExtractableCode {

    private ExtractableCode() {
    }

    static Optional<NodePath> find(Program program, Selection selection) {
        NodePath[] found = {null};
        Traversal.traverse(program, (path, rewrite) -> {
            if (!selection.isInsidePath(path)) {
                return TraversalControl.SKIP_SUBTREE;
            }
            if (isExtractable(path)) {
                found[0] = path;
            }
            return TraversalControl.CONTINUE;
        });
        return Optional.ofNullable(found[0]);
    }

    static boolean isExtractable(NodePath path) {
        if (!(path.node() instanceof Expression)) {
            return false;
        }
        Node parent = path.parentNode();
        String key = path.key();

        if (parent instanceof MemberExpression member && "property".equals(key) && !member.computed()) {
            return false;
        }
        if (parent instanceof Property property) {
            if ("key".equals(key) && !property.computed()) {
                return false;
            }
            if (property.shorthand()) {
                return false;
            }
            if (path.parent().parentNode() instanceof ObjectPattern) {
                return false;
            }
        }
        if (parent instanceof VariableDeclarator && "id".equals(key)) {
            return false;
        }
        if (parent instanceof FunctionDeclaration) {
            return false;
        }
        if (parent instanceof ArrowFunctionExpression && "params".equals(key)) {
            return false;
        }
        return !(parent instanceof AssignmentExpression && "left".equals(key));
    }
}
