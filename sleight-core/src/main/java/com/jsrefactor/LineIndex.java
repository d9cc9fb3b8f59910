package com.jsrefactor;

import com.jsrefactor.ast.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 * Offsets of line starts in a source text, for converting between offsets and
 * (line, column) positions. Lines are 1-based, columns 0-based.
 */
public final class LineIndex {
    private final int[] lineOffsets; // Starting offset of each line
    private final int sourceLength;

    public LineIndex(String source) {
        this.sourceLength = source.length();
        this.lineOffsets = buildLineOffsetIndex(source);
    }

    private static int[] buildLineOffsetIndex(String source) {
        List<Integer> offsets = new ArrayList<>();
        offsets.add(0); // Line 1 starts at offset 0

        for (int i = 0; i < source.length(); i++) {
            char ch = source.charAt(i);
            // Handle all line terminators: LF, CR, CRLF, LS, PS
            if (ch == '\n') {
                offsets.add(i + 1);
            } else if (ch == '\r') {
                // Check for CRLF (skip the LF if present)
                if (i + 1 < source.length() && source.charAt(i + 1) == '\n') {
                    i++;
                }
                offsets.add(i + 1);
            } else if (ch == '\u2028' || ch == '\u2029') {
                offsets.add(i + 1);
            }
        }

        return offsets.stream().mapToInt(Integer::intValue).toArray();
    }

    public int lineCount() {
        return lineOffsets.length;
    }

    /**
     * Offset of the first character of a 1-based line.
     */
    public int lineStart(int line) {
        if (line < 1 || line > lineOffsets.length) {
            throw new IndexOutOfBoundsException("Line " + line + " is outside 1.." + lineOffsets.length);
        }
        return lineOffsets[line - 1];
    }

    // Binary search for the line containing the offset (O(log n))
    public SourceLocation.Position positionAt(int offset) {
        offset = Math.max(0, Math.min(offset, sourceLength));

        int low = 0;
        int high = lineOffsets.length - 1;
        int line = 1;

        while (low <= high) {
            int mid = (low + high) / 2;
            if (lineOffsets[mid] <= offset) {
                line = mid + 1; // Lines are 1-indexed
                low = mid + 1;
            } else {
                high = mid - 1;
            }
        }

        return new SourceLocation.Position(line, offset - lineOffsets[line - 1]);
    }

    /**
     * Offset of a 1-based line and 0-based column, clamped to the source length.
     */
    public int offsetAt(int line, int column) {
        return Math.min(lineStart(line) + column, sourceLength);
    }
}
