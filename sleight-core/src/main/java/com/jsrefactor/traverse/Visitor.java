package com.jsrefactor.traverse;

import com.jsrefactor.ast.Node;

/**
 * Callback invoked for each node of a traversal, in pre-order. Replacements
 * are recorded on the {@link Rewrite} and applied after the walk.
 */
@FunctionalInterface
public interface Visitor {

    TraversalControl enter(NodePath path, Rewrite rewrite);

    /**
     * A visitor that only sees nodes of the given type and continues past
     * every other node.
     */
    static <T extends Node> Visitor on(Class<T> type, NodeVisitor<T> visitor) {
        return (path, rewrite) -> type.isInstance(path.node())
            ? visitor.visit(type.cast(path.node()), path, rewrite)
            : TraversalControl.CONTINUE;
    }

    @FunctionalInterface
    interface NodeVisitor<T extends Node> {
        TraversalControl visit(T node, NodePath path, Rewrite rewrite);
    }
}
