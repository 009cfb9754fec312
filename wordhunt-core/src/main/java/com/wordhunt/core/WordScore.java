package com.wordhunt.core;

import java.util.Objects;

/**
 * Word Hunt point values by word length.
 */
public final class WordScore {

    public static final int MIN_SCORING_LENGTH = 3;

    private static final int[] SCORES_BY_LENGTH = {0, 0, 0, 1, 1, 2, 3, 5};
    private static final int LONG_WORD_SCORE = 11;

    private WordScore() {
    }

    /**
     * Returns the score of the provided word; zero means the word is too short to count.
     */
    public static int score(String word) {
        Objects.requireNonNull(word, "word");
        return forLength(word.length());
    }

    /**
     * Returns the score awarded to a word of the provided length.
     */
    public static int forLength(int length) {
        if (length < 0) {
            throw new IllegalArgumentException("Length must not be negative: " + length);
        }
        return length < SCORES_BY_LENGTH.length ? SCORES_BY_LENGTH[length] : LONG_WORD_SCORE;
    }
}
