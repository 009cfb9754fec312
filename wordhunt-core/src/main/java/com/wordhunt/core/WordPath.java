package com.wordhunt.core;

import java.util.List;
import java.util.Objects;

/**
 * Ordered sequence of cells whose letters, read in order, spell a discovered word.
 */
public record WordPath(List<Cell> cells) {

    public WordPath {
        Objects.requireNonNull(cells, "cells");
        if (cells.isEmpty()) {
            throw new IllegalArgumentException("A path must contain at least one cell");
        }
        cells = List.copyOf(cells);
    }

    /**
     * Builds a path from row-major cell indices of a grid with {@code cols} columns.
     */
    public static WordPath fromIndices(int[] indices, int length, int cols) {
        Cell[] cells = new Cell[length];
        for (int i = 0; i < length; i++) {
            cells[i] = new Cell(indices[i] / cols, indices[i] % cols);
        }
        return new WordPath(List.of(cells));
    }

    public int length() {
        return cells.size();
    }

    public Cell first() {
        return cells.get(0);
    }

    public Cell last() {
        return cells.get(cells.size() - 1);
    }

    /**
     * Returns the letters under this path on the provided grid.
     */
    public String spell(Grid grid) {
        StringBuilder builder = new StringBuilder(cells.size());
        for (Cell cell : cells) {
            builder.append(grid.letterAt(cell.row(), cell.col()));
        }
        return builder.toString();
    }

    /**
     * Returns {@code true} if consecutive cells are adjacent and no cell repeats.
     */
    public boolean isSimple() {
        for (int i = 0; i < cells.size(); i++) {
            Cell current = cells.get(i);
            if (i > 0 && !cells.get(i - 1).isAdjacentTo(current)) {
                return false;
            }
            for (int j = i + 1; j < cells.size(); j++) {
                if (current.equals(cells.get(j))) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Formats the path as {@code (r,c)->(r,c)->...}.
     */
    public String format(boolean oneBased) {
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0) {
                builder.append("->");
            }
            builder.append(cells.get(i).format(oneBased));
        }
        return builder.toString();
    }
}
