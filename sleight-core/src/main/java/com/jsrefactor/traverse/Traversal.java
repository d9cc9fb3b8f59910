package com.jsrefactor.traverse;

import com.jsrefactor.ast.Node;
import com.jsrefactor.ast.Nodes;

/**
 * Depth-first, pre-order walk over a tree, children in source field order.
 */
public final class Traversal {

    private Traversal() {
    }

    public static Rewrite traverse(Node root, Visitor visitor) {
        Rewrite rewrite = new Rewrite();
        walk(NodePath.root(root), visitor, rewrite);
        return rewrite;
    }

    static boolean traverseChildren(NodePath path, Visitor visitor, Rewrite rewrite) {
        for (Nodes.Child child : Nodes.children(path.node())) {
            if (!walk(path.child(child), visitor, rewrite)) {
                return false;
            }
        }
        return true;
    }

    // Returns false once the visitor asked to stop
    private static boolean walk(NodePath path, Visitor visitor, Rewrite rewrite) {
        TraversalControl control = visitor.enter(path, rewrite);
        if (control == TraversalControl.STOP) {
            return false;
        }
        if (control == TraversalControl.SKIP_SUBTREE) {
            return true;
        }
        return traverseChildren(path, visitor, rewrite);
    }
}
