package com.wordhunt.core.solver;

import com.wordhunt.core.WordPath;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Result payload returned by {@link Solver} implementations. The word map iterates in discovery
 * order and keeps the first path found for every word.
 */
public record SolveResult(Map<String, WordPath> words, long visitedNodes, boolean timedOut, long elapsedNanos) {

    public SolveResult {
        Objects.requireNonNull(words, "words");
        words = Collections.unmodifiableMap(new LinkedHashMap<>(words));
    }

    public int wordCount() {
        return words.size();
    }

    public double elapsedMillis() {
        return elapsedNanos / 1_000_000.0;
    }
}
