package com.jsrefactor.refactoring;

import com.jsrefactor.ast.Node;
import com.jsrefactor.editor.Selection;
import com.jsrefactor.traverse.NodePath;
import com.jsrefactor.traverse.TraversalControl;
import com.jsrefactor.traverse.Visitor;

import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Visitors that rewrite the node under the selection.
 */
public final class SelectionVisitors {

    private SelectionVisitors() {
    }

    /**
     * Rewrites the innermost candidate containing the selection. Candidates
     * are visited parent first, so an outer candidate steps aside when one of
     * its descendants also contains the selection and converts to something
     * different. A conversion returning the node itself means "not
     * convertible".
     */
    public static Visitor innermost(Selection selection, Predicate<NodePath> isCandidate, Function<NodePath, Node> convert) {
        return (path, rewrite) -> {
            if (!isCandidate.test(path) || !selection.isInsidePath(path)) {
                return TraversalControl.CONTINUE;
            }
            if (hasChildWhichMatchesSelection(path, selection, isCandidate, convert)) {
                return TraversalControl.CONTINUE;
            }
            Node converted = convert.apply(path);
            if (converted == path.node()) {
                return TraversalControl.CONTINUE;
            }
            rewrite.replace(path, converted);
            return TraversalControl.SKIP_SUBTREE;
        };
    }

    private static boolean hasChildWhichMatchesSelection(NodePath path, Selection selection,
                                                         Predicate<NodePath> isCandidate, Function<NodePath, Node> convert) {
        boolean[] result = {false};
        path.traverse((childPath, ignored) -> {
            if (!isCandidate.test(childPath) || !selection.isInsidePath(childPath)) {
                return TraversalControl.CONTINUE;
            }
            if (convert.apply(childPath) == childPath.node()) {
                return TraversalControl.CONTINUE;
            }
            result[0] = true;
            return TraversalControl.STOP;
        });
        return result[0];
    }
}
