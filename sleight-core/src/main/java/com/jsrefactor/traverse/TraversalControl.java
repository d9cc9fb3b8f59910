package com.jsrefactor.traverse;

/**
 * What a {@link Visitor} wants the traversal to do after visiting a node.
 */
public enum TraversalControl {
    /** Descend into the node's children. */
    CONTINUE,
    /** Do not visit the node's children, carry on with its siblings. */
    SKIP_SUBTREE,
    /** End the whole traversal. */
    STOP
}
