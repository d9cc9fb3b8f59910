package com.jsrefactor.editor;

import com.jsrefactor.ast.Node;
import com.jsrefactor.ast.SourceLocation;
import com.jsrefactor.traverse.NodePath;

/**
 * A range of a document; a cursor when start and end coincide. The start is
 * never after the end.
 */
public record Selection(Position start, Position end) {

    public Selection {
        if (end.isBefore(start)) {
            Position swap = start;
            start = end;
            end = swap;
        }
    }

    public static Selection fromPositions(int startLine, int startCharacter, int endLine, int endCharacter) {
        return new Selection(new Position(startLine, startCharacter), new Position(endLine, endCharacter));
    }

    public static Selection cursorAt(int line, int character) {
        return cursorAtPosition(new Position(line, character));
    }

    public static Selection cursorAtPosition(Position position) {
        return new Selection(position, position);
    }

    public static Selection fromAst(SourceLocation loc) {
        return new Selection(Position.fromAst(loc.start()), Position.fromAst(loc.end()));
    }

    public static Selection fromNode(Node node) {
        return fromAst(node.loc());
    }

    public boolean isEmpty() {
        return start.equals(end);
    }

    public boolean isMultiLines() {
        return start.line() != end.line();
    }

    /**
     * Number of line breaks the selection spans.
     */
    public int height() {
        return end.line() - start.line();
    }

    /**
     * Whether this selection lies within the given one, bounds included.
     */
    public boolean isInside(Selection other) {
        return !start.isBefore(other.start) && !end.isAfter(other.end);
    }

    /**
     * Whether this selection lies within the node's range, bounds included.
     * Nodes without a source range contain nothing.
     */
    public boolean isInsideNode(Node node) {
        return node != null && node.hasLocation() && isInside(fromNode(node));
    }

    public boolean isInsidePath(NodePath path) {
        return isInsideNode(path.node());
    }

    /**
     * Whether this selection lies within the node's range without touching
     * either bound.
     */
    public boolean isStrictlyInsideNode(Node node) {
        if (node == null || !node.hasLocation()) {
            return false;
        }
        Selection nodeSelection = fromNode(node);
        return start.isAfter(nodeSelection.start) && end.isBefore(nodeSelection.end);
    }

    /**
     * This selection's end, starting where {@code other} ends.
     */
    public Selection extendStartToEndOf(Selection other) {
        return new Selection(other.end, end);
    }

    public Selection addLines(int lines) {
        return new Selection(start.addLines(lines), end.addLines(lines));
    }

    public Selection removeLines(int lines) {
        return new Selection(start.removeLines(lines), end.removeLines(lines));
    }

    @Override
    public String toString() {
        return "[" + start + " - " + end + "]";
    }
}
