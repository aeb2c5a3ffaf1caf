package com.polyast.core.lang;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Converts between character offsets and 1-based line/column positions.
 *
 * <p>Rhino reports absolute offsets and JavaParser reports line/column pairs; the
 * normalizers use this index to fill in whichever half is missing.
 *
 * @since 1.0.0
 */
public final class LineIndex {

    private final int[] lineStarts;
    private final int length;

    public LineIndex(String content) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);
            if (c == '\n') {
                starts.add(i + 1);
            } else if (c == '\r' && (i + 1 >= content.length() || content.charAt(i + 1) != '\n')) {
                starts.add(i + 1);
            }
        }
        this.lineStarts = starts.stream().mapToInt(Integer::intValue).toArray();
        this.length = content.length();
    }

    public int lineCount() {
        return lineStarts.length;
    }

    /**
     * Returns the 1-based line containing the offset.
     */
    public int lineOf(int offset) {
        int index = Arrays.binarySearch(lineStarts, clamp(offset));
        return index >= 0 ? index + 1 : -index - 1;
    }

    /**
     * Returns the 1-based column of the offset within its line.
     */
    public int columnOf(int offset) {
        int clamped = clamp(offset);
        return clamped - lineStarts[lineOf(clamped) - 1] + 1;
    }

    /**
     * Returns the offset of a 1-based line/column pair, or {@code -1} when the line is
     * outside the file.
     */
    public int offsetOf(int line, int column) {
        if (line < 1 || line > lineStarts.length) {
            return -1;
        }
        return lineStarts[line - 1] + column - 1;
    }

    private int clamp(int offset) {
        return Math.max(0, Math.min(offset, length));
    }
}
