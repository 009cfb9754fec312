package com.wordhunt.core.solver;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.wordhunt.core.Grid;
import com.wordhunt.core.WordPath;
import java.util.Collection;
import java.util.Map;

/**
 * Shared checks for solver results.
 */
public final class SolverAssertions {

    private SolverAssertions() {
    }

    /**
     * Every path spells its word, is a simple king-move path, and every word is a dictionary word
     * of at least {@code minLength} letters.
     */
    public static void assertSoundResult(Grid grid, Collection<String> dictionary, int minLength,
            Map<String, WordPath> words) {
        for (Map.Entry<String, WordPath> entry : words.entrySet()) {
            String word = entry.getKey();
            WordPath path = entry.getValue();
            assertEquals(word, path.spell(grid), "path letters must spell " + word);
            assertEquals(word.length(), path.length());
            assertTrue(path.isSimple(), "path must be simple and adjacent: " + path.format(false));
            assertTrue(dictionary.contains(word), "not a dictionary word: " + word);
            assertTrue(word.length() >= minLength, "shorter than minimum: " + word);
        }
    }
}
