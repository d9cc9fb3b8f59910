package com.jsrefactor;

import com.jsrefactor.ast.SourceLocation;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class LineIndexTest {

    @Test
    void testPositionAt() {
        LineIndex index = new LineIndex("ab\ncd\n");

        assertEquals(3, index.lineCount());
        assertEquals(new SourceLocation.Position(1, 0), index.positionAt(0));
        assertEquals(new SourceLocation.Position(1, 2), index.positionAt(2));
        assertEquals(new SourceLocation.Position(2, 1), index.positionAt(4));
        assertEquals(new SourceLocation.Position(3, 0), index.positionAt(6));
    }

    @Test
    void testAllLineTerminators() {
        LineIndex index = new LineIndex("a\r\nb\rc\u2028d\u2029e");

        assertEquals(5, index.lineCount());
        assertEquals(3, index.lineStart(2));
        assertEquals(5, index.lineStart(3));
        assertEquals(new SourceLocation.Position(5, 0), index.positionAt(9));
    }

    @Test
    void testOffsetAtIsClamped() {
        LineIndex index = new LineIndex("abc\nde");

        assertEquals(5, index.offsetAt(2, 1));
        assertEquals(6, index.offsetAt(2, 40));
        assertThrows(IndexOutOfBoundsException.class, () -> index.lineStart(3));
    }
}
