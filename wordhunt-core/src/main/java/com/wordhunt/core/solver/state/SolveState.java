package com.wordhunt.core.solver.state;

import com.wordhunt.core.Grid;
import com.wordhunt.core.WordPath;
import com.wordhunt.core.trie.TrieNode;
import java.util.Map;
import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * Mutable search buffers for one backtracking walk: the visited flags, the current path and the
 * letters spelled so far. A cell is marked on entry to its frame and cleared before the frame
 * returns, so the buffers are clean again after every {@link #explore} call.
 */
public final class SolveState {

    private static final int STOP_CHECK_MASK = 1023;

    private final Grid grid;
    private final int[][] neighbors;
    private final int minLength;
    private final BooleanSupplier stopCheck;

    private final boolean[] visited;
    private final int[] path;
    private final char[] letters;

    private int depth;
    private long visitedNodes;
    private boolean aborted;

    /**
     * @param grid the grid to walk
     * @param neighbors neighbour indices per row-major cell index
     * @param minLength shortest word that is recorded
     * @param stopCheck polled every 1024 visited frames; returning {@code true} aborts the walk
     */
    public SolveState(Grid grid, int[][] neighbors, int minLength, BooleanSupplier stopCheck) {
        this.grid = Objects.requireNonNull(grid, "grid");
        this.neighbors = Objects.requireNonNull(neighbors, "neighbors");
        this.stopCheck = Objects.requireNonNull(stopCheck, "stopCheck");
        if (neighbors.length != grid.cellCount()) {
            throw new IllegalArgumentException("Neighbour table does not match the grid size");
        }
        if (minLength < 1) {
            throw new IllegalArgumentException("minLength must be at least 1");
        }
        this.minLength = minLength;
        this.visited = new boolean[grid.cellCount()];
        this.path = new int[grid.cellCount()];
        this.letters = new char[grid.cellCount()];
    }

    /**
     * Walks every simple path that starts at {@code startCell} and spells a prefix under
     * {@code root}. Words not yet in {@code found} are added with the current path.
     *
     * @return {@code false} if the walk was aborted by the stop check
     */
    public boolean explore(int startCell, TrieNode root, Map<String, WordPath> found) {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(found, "found");
        if (startCell < 0 || startCell >= visited.length) {
            throw new IllegalArgumentException("Cell index out of range: " + startCell);
        }
        if (aborted) {
            return false;
        }
        depth = 0;
        visit(startCell, root, found);
        return !aborted;
    }

    private void visit(int cell, TrieNode node, Map<String, WordPath> found) {
        char letter = grid.letterAt(cell);
        TrieNode next = node.child(letter);
        if (next == null) {
            return;
        }
        if ((++visitedNodes & STOP_CHECK_MASK) == 0 && stopCheck.getAsBoolean()) {
            aborted = true;
        }
        if (aborted) {
            return;
        }

        visited[cell] = true;
        path[depth] = cell;
        letters[depth] = letter;
        depth++;

        if (depth >= minLength && next.isWord()) {
            String word = new String(letters, 0, depth);
            if (!found.containsKey(word)) {
                found.put(word, WordPath.fromIndices(path, depth, grid.cols()));
            }
        }

        if (next.hasChildren()) {
            for (int neighbor : neighbors[cell]) {
                if (aborted) {
                    break;
                }
                if (!visited[neighbor]) {
                    visit(neighbor, next, found);
                }
            }
        }

        depth--;
        visited[cell] = false;
    }

    /**
     * Returns the number of frames whose letter matched a trie child.
     */
    public long visitedNodes() {
        return visitedNodes;
    }

    public boolean isAborted() {
        return aborted;
    }

    /**
     * Returns the current path length; zero whenever no walk is in progress.
     */
    public int depth() {
        return depth;
    }

    public boolean isVisited(int cell) {
        return visited[cell];
    }
}
