package com.jsrefactor.traverse;

import com.jsrefactor.ast.Node;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Replacements collected during a traversal, keyed by node identity. Two
 * structurally equal nodes at different places stay distinct.
 */
public final class Rewrite {
    private final Map<Node, Node> replacements = new IdentityHashMap<>();

    /**
     * Schedules the node at {@code path} to be replaced. Replacing a node with
     * itself is a no-op.
     */
    public void replace(NodePath path, Node replacement) {
        if (replacement == path.node()) {
            return;
        }
        replacements.put(path.node(), replacement);
    }

    public boolean isEmpty() {
        return replacements.isEmpty();
    }

    public Map<Node, Node> replacements() {
        return Collections.unmodifiableMap(replacements);
    }
}
