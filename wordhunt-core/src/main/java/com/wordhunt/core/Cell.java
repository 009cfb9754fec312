package com.wordhunt.core;

/**
 * Zero-based grid coordinate.
 */
public record Cell(int row, int col) {

    public Cell {
        if (row < 0 || col < 0) {
            throw new IllegalArgumentException("Cell coordinates must be non-negative: (" + row + "," + col + ")");
        }
    }

    /**
     * Returns {@code true} if the other cell is one of the eight king-move neighbours of this cell.
     */
    public boolean isAdjacentTo(Cell other) {
        int dr = Math.abs(row - other.row);
        int dc = Math.abs(col - other.col);
        return (dr | dc) != 0 && dr <= 1 && dc <= 1;
    }

    /**
     * Formats the coordinate as {@code (r,c)}, optionally shifted to one-based numbering.
     */
    public String format(boolean oneBased) {
        int offset = oneBased ? 1 : 0;
        return "(" + (row + offset) + "," + (col + offset) + ")";
    }

    @Override
    public String toString() {
        return format(false);
    }
}
