package com.wordhunt.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class WordScoreTest {

    @Test
    void scoresFollowLengthTable() {
        assertEquals(0, WordScore.score("ab"));
        assertEquals(1, WordScore.score("cat"));
        assertEquals(1, WordScore.score("tree"));
        assertEquals(2, WordScore.score("abcde"));
        assertEquals(3, WordScore.score("abcdef"));
        assertEquals(5, WordScore.score("abcdefg"));
        assertEquals(11, WordScore.score("abcdefgh"));
    }

    @Test
    void longWordsAllScoreEleven() {
        assertEquals(11, WordScore.forLength(9));
        assertEquals(11, WordScore.forLength(16));
    }

    @Test
    void shortWordsScoreNothing() {
        assertEquals(0, WordScore.forLength(0));
        assertEquals(0, WordScore.forLength(1));
        assertEquals(0, WordScore.forLength(2));
    }

    @Test
    void rejectsNegativeLength() {
        assertThrows(IllegalArgumentException.class, () -> WordScore.forLength(-1));
    }
}
