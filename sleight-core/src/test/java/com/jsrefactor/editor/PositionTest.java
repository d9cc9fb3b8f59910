package com.jsrefactor.editor;

import com.jsrefactor.ast.SourceLocation;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class PositionTest {

    @Test
    void testOrdering() {
        Position a = new Position(1, 5);
        Position b = new Position(2, 0);

        assertTrue(a.isBefore(b));
        assertTrue(b.isAfter(a));
        assertFalse(a.isBefore(a));
        assertTrue(new Position(1, 2).isBefore(a));
    }

    @Test
    void testFromAstShiftsLine() {
        assertEquals(new Position(0, 3), Position.fromAst(new SourceLocation.Position(1, 3)));
    }

    @Test
    void testLineArithmetic() {
        Position position = new Position(3, 4);

        assertEquals(new Position(5, 4), position.addLines(2));
        assertEquals(new Position(1, 4), position.removeLines(2));
        assertEquals(new Position(3, 9), position.putAtSameCharacter(new Position(0, 9)));
        assertEquals("3:4", position.toString());
    }

    @Test
    void testRejectsNegative() {
        assertThrows(IllegalArgumentException.class, () -> new Position(-1, 0));
        assertThrows(IllegalArgumentException.class, () -> new Position(2, 3).removeLines(3));
    }
}
