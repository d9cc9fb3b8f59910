package com.jsrefactor.editor;

import com.jsrefactor.Parser;
import com.jsrefactor.ast.ExpressionStatement;
import com.jsrefactor.ast.Identifier;
import com.jsrefactor.ast.Node;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SelectionTest {

    @Test
    void testReversedSelectionIsNormalized() {
        Selection selection = Selection.fromPositions(2, 4, 1, 0);

        assertEquals(new Position(1, 0), selection.start());
        assertEquals(new Position(2, 4), selection.end());
        assertTrue(selection.isMultiLines());
        assertEquals(1, selection.height());
    }

    @Test
    void testCursor() {
        Selection cursor = Selection.cursorAt(0, 3);

        assertTrue(cursor.isEmpty());
        assertFalse(cursor.isMultiLines());
        assertEquals(0, cursor.height());
    }

    @Test
    void testIsInsideIncludesBounds() {
        Selection outer = Selection.fromPositions(0, 2, 0, 8);

        assertTrue(Selection.fromPositions(0, 2, 0, 8).isInside(outer));
        assertTrue(Selection.cursorAt(0, 8).isInside(outer));
        assertFalse(Selection.fromPositions(0, 1, 0, 4).isInside(outer));
    }

    @Test
    void testNodeContainment() {
        Node node = ((ExpressionStatement) Parser.parse("foo(bar);").body().get(0)).expression();

        assertEquals(Selection.fromPositions(0, 0, 0, 8), Selection.fromNode(node));
        assertTrue(Selection.cursorAt(0, 4).isInsideNode(node));
        assertTrue(Selection.cursorAt(0, 4).isStrictlyInsideNode(node));
        assertFalse(Selection.cursorAt(0, 0).isStrictlyInsideNode(node));
        assertFalse(Selection.cursorAt(0, 9).isInsideNode(node));
    }

    @Test
    void testSynthesizedNodeContainsNothing() {
        Identifier synthesized = new Identifier("x");

        assertFalse(Selection.cursorAt(0, 0).isInsideNode(synthesized));
        assertFalse(Selection.cursorAt(0, 0).isStrictlyInsideNode(synthesized));
        assertFalse(Selection.cursorAt(0, 0).isInsideNode(null));
    }

    @Test
    void testExtendStartToEndOf() {
        Selection value = Selection.fromPositions(0, 10, 0, 15);
        Selection key = Selection.fromPositions(0, 4, 0, 7);

        assertEquals(Selection.fromPositions(0, 7, 0, 15), value.extendStartToEndOf(key));
    }

    @Test
    void testLineShifts() {
        Selection selection = Selection.fromPositions(3, 1, 4, 2);

        assertEquals(Selection.fromPositions(5, 1, 6, 2), selection.addLines(2));
        assertEquals(Selection.fromPositions(0, 1, 1, 2), selection.removeLines(3));
    }
}
