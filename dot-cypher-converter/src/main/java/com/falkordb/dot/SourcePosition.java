package com.falkordb.dot;

/**
 * A 1-based line and column in DOT source text.
 *
 * @param line the line number, starting at 1
 * @param column the column number, starting at 1
 */
public record SourcePosition(int line, int column) {

    /**
     * Validates the coordinates.
     *
     * @param line the line number
     * @param column the column number
     */
    public SourcePosition {
        if (line < 1 || column < 1) {
            throw new IllegalArgumentException(
                "Position must be 1-based: " + line + ":" + column);
        }
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
