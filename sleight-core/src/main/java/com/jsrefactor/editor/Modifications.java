package com.jsrefactor.editor;

import com.jsrefactor.LineIndex;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Applies several text modifications to a document in one pass. All
 * selections refer to the original text.
 */
public final class Modifications {

    private Modifications() {
    }

    /**
     * @throws IllegalArgumentException if two modifications overlap
     */
    public static String apply(String code, List<Modification> modifications) {
        LineIndex lineIndex = new LineIndex(code);
        List<Range> ranges = new ArrayList<>();
        for (Modification modification : modifications) {
            ranges.add(new Range(offset(lineIndex, code, modification.selection().start()),
                offset(lineIndex, code, modification.selection().end()), modification.code()));
        }

        // Later ranges first; at equal starts the replacement goes before the insertion
        ranges.sort(Comparator.comparingInt(Range::start).thenComparingInt(Range::end).reversed());

        StringBuilder result = new StringBuilder(code);
        Range previous = null;
        for (Range range : ranges) {
            if (previous != null && range.end() > previous.start()) {
                throw new IllegalArgumentException("Overlapping modifications at offset " + previous.start());
            }
            result.replace(range.start(), range.end(), range.code());
            previous = range;
        }
        return result.toString();
    }

    private static int offset(LineIndex lineIndex, String code, Position position) {
        if (position.line() >= lineIndex.lineCount()) {
            return code.length();
        }
        return lineIndex.offsetAt(position.line() + 1, position.character());
    }

    private record Range(int start, int end, String code) {
    }
}
