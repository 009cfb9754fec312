package com.wordhunt.visualizer.model;

import com.wordhunt.core.Grid;
import com.wordhunt.core.result.ResultEntry;
import com.wordhunt.core.solver.SolveResult;
import com.wordhunt.core.trie.Trie;
import java.util.List;
import java.util.Objects;

/**
 * Snapshot of one completed solve: the grid, the dictionary used, the raw result and the ranked
 * entries shown to the user.
 */
public record SolveFrame(
        Grid grid,
        Trie trie,
        String dictionaryLabel,
        SolveResult result,
        List<ResultEntry> entries,
        int minLength) {

    public SolveFrame {
        Objects.requireNonNull(grid, "grid");
        Objects.requireNonNull(trie, "trie");
        Objects.requireNonNull(dictionaryLabel, "dictionaryLabel");
        Objects.requireNonNull(result, "result");
        entries = List.copyOf(entries);
    }

    public int foundCount() {
        return result.wordCount();
    }

    public int shownCount() {
        return entries.size();
    }
}
