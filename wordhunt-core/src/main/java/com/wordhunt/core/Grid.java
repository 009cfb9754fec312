package com.wordhunt.core;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Immutable rectangular grid of lowercase letters stored in row-major order.
 * Cells are addressed either by {@code (row, col)} or by their row-major index.
 */
public final class Grid {

    private final int rows;
    private final int cols;
    private final char[] letters;

    private Grid(int rows, int cols, char[] letters) {
        this.rows = rows;
        this.cols = cols;
        this.letters = letters;
    }

    /**
     * Creates a grid from row strings, one letter per character.
     */
    public static Grid of(String... rows) {
        Objects.requireNonNull(rows, "rows");
        return of(List.of(rows));
    }

    /**
     * Creates a grid from row strings, one letter per character.
     */
    public static Grid of(List<String> rows) {
        Objects.requireNonNull(rows, "rows");
        if (rows.isEmpty()) {
            throw new InvalidGridException("Grid must have at least one row");
        }
        int cols = Objects.requireNonNull(rows.get(0), "row").length();
        if (cols == 0) {
            throw new InvalidGridException("Grid must have at least one column");
        }
        char[] letters = new char[checkedCellCount(rows.size(), cols)];
        for (int row = 0; row < rows.size(); row++) {
            String line = Objects.requireNonNull(rows.get(row), "row");
            if (line.length() != cols) {
                throw new InvalidGridException("Row " + row + " has " + line.length()
                        + " letters, expected " + cols);
            }
            line.getChars(0, cols, letters, row * cols);
        }
        return create(rows.size(), cols, letters);
    }

    /**
     * Creates a grid from a two-dimensional array of letters.
     */
    public static Grid of(char[][] cells) {
        Objects.requireNonNull(cells, "cells");
        if (cells.length == 0) {
            throw new InvalidGridException("Grid must have at least one row");
        }
        int cols = Objects.requireNonNull(cells[0], "row").length;
        if (cols == 0) {
            throw new InvalidGridException("Grid must have at least one column");
        }
        char[] letters = new char[checkedCellCount(cells.length, cols)];
        for (int row = 0; row < cells.length; row++) {
            Objects.requireNonNull(cells[row], "row");
            if (cells[row].length != cols) {
                throw new InvalidGridException("Row " + row + " has " + cells[row].length
                        + " letters, expected " + cols);
            }
            System.arraycopy(cells[row], 0, letters, row * cols, cols);
        }
        return create(cells.length, cols, letters);
    }

    /**
     * Creates a {@code rows x cols} grid from a compact row-major letter string.
     */
    public static Grid of(int rows, int cols, String letters) {
        Objects.requireNonNull(letters, "letters");
        if (rows < 1 || cols < 1) {
            throw new InvalidGridException("Grid dimensions must be positive: " + rows + "x" + cols);
        }
        int cellCount = checkedCellCount(rows, cols);
        if (letters.length() != cellCount) {
            throw new InvalidGridException("Expected " + cellCount + " letters, got " + letters.length());
        }
        return create(rows, cols, letters.toCharArray());
    }

    private static int checkedCellCount(int rows, int cols) {
        long cells = (long) rows * cols;
        if (cells > Integer.MAX_VALUE) {
            throw new InvalidGridException("Grid is too large: " + rows + "x" + cols);
        }
        return (int) cells;
    }

    private static Grid create(int rows, int cols, char[] letters) {
        for (int index = 0; index < letters.length; index++) {
            char letter = letters[index];
            if (letter < 'a' || letter > 'z') {
                throw new InvalidGridException("Cell (" + index / cols + "," + index % cols
                        + ") is not a lowercase letter: '" + letter + "'");
            }
        }
        return new Grid(rows, cols, letters);
    }

    public int rows() {
        return rows;
    }

    public int cols() {
        return cols;
    }

    /**
     * Returns the total number of cells, which is also the longest possible word.
     */
    public int cellCount() {
        return letters.length;
    }

    public char letterAt(int row, int col) {
        checkCell(row, col);
        return letters[row * cols + col];
    }

    /**
     * Returns the letter at the provided row-major index.
     */
    public char letterAt(int index) {
        if (index < 0 || index >= letters.length) {
            throw new IllegalArgumentException("Cell index out of range: " + index);
        }
        return letters[index];
    }

    public int indexOf(int row, int col) {
        checkCell(row, col);
        return row * cols + col;
    }

    /**
     * Returns the grid rows as strings.
     */
    public List<String> toRows() {
        String[] lines = new String[rows];
        for (int row = 0; row < rows; row++) {
            lines[row] = new String(letters, row * cols, cols);
        }
        return List.of(lines);
    }

    private void checkCell(int row, int col) {
        if (row < 0 || row >= rows || col < 0 || col >= cols) {
            throw new IllegalArgumentException("Cell out of range: (" + row + "," + col + ") on "
                    + rows + "x" + cols + " grid");
        }
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Grid grid)) {
            return false;
        }
        return rows == grid.rows && cols == grid.cols && Arrays.equals(letters, grid.letters);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * rows + cols) + Arrays.hashCode(letters);
    }

    @Override
    public String toString() {
        return String.join("/", toRows());
    }
}
