package com.jsrefactor.traverse;

import com.jsrefactor.ast.Node;
import com.jsrefactor.ast.Nodes;

import java.util.Optional;
import java.util.function.Predicate;

/**
 * A node together with the chain of ancestors it was reached through.
 * Paths are immutable; {@link #withNode(Node)} produces a sibling path that
 * puts a different node in the same slot of the same parent.
 */
public final class NodePath {
    private final Node node;
    private final NodePath parent;
    private final String key;
    private final int index;

    private NodePath(Node node, NodePath parent, String key, int index) {
        this.node = node;
        this.parent = parent;
        this.key = key;
        this.index = index;
    }

    public static NodePath root(Node node) {
        return new NodePath(node, null, null, -1);
    }

    NodePath child(Nodes.Child child) {
        return new NodePath(child.node(), this, child.key(), child.index());
    }

    public Node node() {
        return node;
    }

    /**
     * Path of the parent node, or null at the root.
     */
    public NodePath parent() {
        return parent;
    }

    public Node parentNode() {
        return parent == null ? null : parent.node;
    }

    /**
     * Name of the parent field holding this node, or null at the root.
     */
    public String key() {
        return key;
    }

    /**
     * Position in the parent field when it is a list, -1 otherwise.
     */
    public int index() {
        return index;
    }

    public boolean isRoot() {
        return parent == null;
    }

    public NodePath withNode(Node replacement) {
        return new NodePath(replacement, parent, key, index);
    }

    /**
     * Nearest strict ancestor matching the predicate.
     */
    public Optional<NodePath> findParent(Predicate<NodePath> predicate) {
        for (NodePath path = parent; path != null; path = path.parent) {
            if (predicate.test(path)) {
                return Optional.of(path);
            }
        }
        return Optional.empty();
    }

    /**
     * Visits the descendants of this node, not the node itself. Replacements
     * requested by the visitor are discarded.
     */
    public void traverse(Visitor visitor) {
        Traversal.traverseChildren(this, visitor, new Rewrite());
    }

    @Override
    public String toString() {
        return (key == null ? "" : key + (index >= 0 ? "[" + index + "]" : "") + ":") + node.type();
    }
}
