package com.smelldetector.core.tree;

/**
 * A point in source text.
 *
 * @param line 1-based line number
 * @param column 0-based column (byte offset within the line, as reported by the parser)
 */
public record Position(int line, int column) {

    public Position {
        if (line < 1) {
            throw new IllegalArgumentException("line must be >= 1, was " + line);
        }
        if (column < 0) {
            throw new IllegalArgumentException("column must be >= 0, was " + column);
        }
    }

    /**
     * Creates a position from the parser's 0-based row.
     *
     * @param row 0-based row
     * @param column 0-based column
     * @return position with a 1-based line
     */
    public static Position fromZeroBasedRow(int row, int column) {
        return new Position(row + 1, column);
    }
}
