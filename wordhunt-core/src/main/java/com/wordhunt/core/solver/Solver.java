package com.wordhunt.core.solver;

import com.wordhunt.core.Grid;
import com.wordhunt.core.trie.Trie;

/**
 * Generic interface for grid word search implementations.
 */
public interface Solver {

    /**
     * Finds every dictionary word spelled by a simple path of adjacent cells on the grid.
     *
     * @param grid the letters to search
     * @param trie the dictionary, read-only for the duration of the call
     * @param constraints the limits guiding the search execution
     * @return the discovered words with one path each
     */
    SolveResult solve(Grid grid, Trie trie, SolveConstraints constraints);

    /**
     * Requests cooperative cancellation of the currently running solve. The interrupted solve
     * returns the words found so far with {@link SolveResult#timedOut()} set. A request is cleared
     * when the next solve starts.
     */
    void requestStop();
}
