package com.wordhunt.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * King-move neighbourhood on a rectangular grid. Offsets are visited with the row offset in the
 * outer loop and the column offset in the inner loop, both from -1 to 1, which fixes the order in
 * which the solver explores neighbours.
 */
public final class Adjacency {

    private Adjacency() {
    }

    /**
     * Returns the in-bounds neighbours of {@code (row, col)} including diagonals.
     */
    public static List<Cell> neighbors(int row, int col, int rows, int cols) {
        return neighbors(row, col, rows, cols, true);
    }

    /**
     * Returns the in-bounds neighbours of {@code (row, col)}. With {@code allowDiagonal} unset only
     * the four orthogonal neighbours are considered.
     */
    public static List<Cell> neighbors(int row, int col, int rows, int cols, boolean allowDiagonal) {
        checkDimensions(rows, cols);
        List<Cell> cells = new ArrayList<>(8);
        for (int index : neighborIndices(row, col, rows, cols, allowDiagonal)) {
            cells.add(new Cell(index / cols, index % cols));
        }
        return cells;
    }

    /**
     * Precomputes the neighbour indices of every cell, keyed by row-major cell index.
     */
    public static int[][] table(int rows, int cols, boolean allowDiagonal) {
        checkDimensions(rows, cols);
        int[][] table = new int[rows * cols][];
        for (int row = 0; row < rows; row++) {
            for (int col = 0; col < cols; col++) {
                table[row * cols + col] = neighborIndices(row, col, rows, cols, allowDiagonal);
            }
        }
        return table;
    }

    private static int[] neighborIndices(int row, int col, int rows, int cols, boolean allowDiagonal) {
        if (row < 0 || row >= rows || col < 0 || col >= cols) {
            throw new IllegalArgumentException("Cell out of range: (" + row + "," + col + ")");
        }
        int[] buffer = new int[8];
        int count = 0;
        for (int dr = -1; dr <= 1; dr++) {
            for (int dc = -1; dc <= 1; dc++) {
                if (dr == 0 && dc == 0) {
                    continue;
                }
                if (!allowDiagonal && dr != 0 && dc != 0) {
                    continue;
                }
                int nr = row + dr;
                int nc = col + dc;
                if (nr >= 0 && nr < rows && nc >= 0 && nc < cols) {
                    buffer[count++] = nr * cols + nc;
                }
            }
        }
        return Arrays.copyOf(buffer, count);
    }

    private static void checkDimensions(int rows, int cols) {
        if (rows < 1 || cols < 1) {
            throw new IllegalArgumentException("Grid dimensions must be positive: " + rows + "x" + cols);
        }
    }
}
