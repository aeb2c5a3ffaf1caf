package com.polyast.core.ast;

import java.util.Objects;

/**
 * Source position of a token.
 *
 * @param file path of the file the token comes from
 * @param line 1-based line number
 * @param column 1-based column number
 * @param offset 0-based character offset from the start of the file, or {@code -1} when unknown
 * @since 1.0.0
 */
public record Location(String file, int line, int column, int offset) implements Comparable<Location> {

    public Location {
        Objects.requireNonNull(file, "file must not be null");
        if (line < 1) {
            throw new IllegalArgumentException("line must be >= 1: " + line);
        }
        if (column < 1) {
            throw new IllegalArgumentException("column must be >= 1: " + column);
        }
    }

    /**
     * Orders locations by file, then offset. Line and column decide when either offset
     * is unknown.
     *
     * @param other location to compare with
     * @return negative, zero or positive as for {@link Comparable#compareTo}
     */
    @Override
    public int compareTo(Location other) {
        int byFile = file.compareTo(other.file);
        if (byFile != 0) {
            return byFile;
        }
        if (offset >= 0 && other.offset >= 0 && offset != other.offset) {
            return Integer.compare(offset, other.offset);
        }
        int byLine = Integer.compare(line, other.line);
        return byLine != 0 ? byLine : Integer.compare(column, other.column);
    }

    @Override
    public String toString() {
        return file + ":" + line + ":" + column;
    }
}
