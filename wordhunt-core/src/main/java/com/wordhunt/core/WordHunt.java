package com.wordhunt.core;

import com.wordhunt.core.result.ResultAssembler;
import com.wordhunt.core.result.ResultEntry;
import com.wordhunt.core.solver.BacktrackingSolver;
import com.wordhunt.core.trie.Trie;
import java.util.List;
import java.util.Map;

/**
 * Entry points used by front ends: build a dictionary, solve a grid, score and rank the results.
 */
public final class WordHunt {

    private WordHunt() {
    }

    /**
     * Builds a trie from non-empty lowercase words.
     */
    public static Trie buildTrie(Iterable<String> words) {
        return Trie.of(words);
    }

    /**
     * Finds every dictionary word of at least {@code minLength} letters on the grid, mapped to the
     * first path discovered for it.
     */
    public static Map<String, WordPath> solve(Grid grid, Trie trie, int minLength) {
        return new BacktrackingSolver().solve(grid, trie, minLength);
    }

    public static int score(String word) {
        return WordScore.score(word);
    }

    public static List<ResultEntry> assemble(Map<String, WordPath> found, int minScore, int topN) {
        return ResultAssembler.assemble(found, minScore, topN);
    }
}
