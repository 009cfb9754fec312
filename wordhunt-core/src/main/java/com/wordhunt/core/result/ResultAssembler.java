package com.wordhunt.core.result;

import com.wordhunt.core.WordPath;
import com.wordhunt.core.WordScore;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns the raw word-to-path map of a solve into a ranked list of {@link ResultEntry} values.
 */
public final class ResultAssembler {

    /**
     * Score descending, then length descending, then word ascending.
     */
    public static final Comparator<ResultEntry> RANKING = Comparator
            .comparingInt(ResultEntry::score).reversed()
            .thenComparing(Comparator.comparingInt(ResultEntry::length).reversed())
            .thenComparing(ResultEntry::word);

    private ResultAssembler() {
    }

    /**
     * Scores every word, drops those below {@code minScore}, sorts by {@link #RANKING} and keeps the
     * first {@code topN} entries. A {@code topN} of zero or less keeps everything.
     */
    public static List<ResultEntry> assemble(Map<String, WordPath> found, int minScore, int topN) {
        Objects.requireNonNull(found, "found");
        List<ResultEntry> entries = new ArrayList<>(found.size());
        for (Map.Entry<String, WordPath> entry : found.entrySet()) {
            int score = WordScore.score(entry.getKey());
            if (score >= minScore) {
                entries.add(new ResultEntry(entry.getKey(), score, entry.getValue()));
            }
        }
        return rank(entries, topN);
    }

    /**
     * Sorts already scored entries by {@link #RANKING} and truncates them to {@code topN}.
     */
    public static List<ResultEntry> rank(List<ResultEntry> entries, int topN) {
        Objects.requireNonNull(entries, "entries");
        List<ResultEntry> sorted = new ArrayList<>(entries);
        sorted.sort(RANKING);
        if (topN > 0 && sorted.size() > topN) {
            return List.copyOf(sorted.subList(0, topN));
        }
        return List.copyOf(sorted);
    }
}
