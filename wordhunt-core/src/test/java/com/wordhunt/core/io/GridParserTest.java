package com.wordhunt.core.io;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.wordhunt.core.Grid;
import com.wordhunt.core.InvalidGridException;
import org.junit.jupiter.api.Test;

class GridParserTest {

    private static final Grid EXPECTED = Grid.of("rnsm", "tduo", "rasa", "ethh");

    @Test
    void parsesMultilineRows() {
        assertEquals(EXPECTED, GridParser.parse("rnsm\ntduo\nrasa\nethh", 4));
        assertEquals(EXPECTED, GridParser.parse("\n  RNSM\r\n tduo \n\nrasa\nethh\n", 4));
    }

    @Test
    void parsesSpacedRows() {
        assertEquals(EXPECTED, GridParser.parse("r n s m\nt d u o\nr a s a\ne t h h", 4));
    }

    @Test
    void parsesSlashSeparatedRows() {
        assertEquals(EXPECTED, GridParser.parse("r n s m / t d u o / r a s a / e t h h", 4));
        assertEquals(EXPECTED, GridParser.parse("rnsm/tduo/rasa/ethh", 4));
    }

    @Test
    void parsesCompactLetters() {
        assertEquals(EXPECTED, GridParser.parse("RNSMTDUORASAETHH", 4));
        assertEquals(EXPECTED, GridParser.parse("  rnsm tduo rasa ethh  ", 4));
    }

    @Test
    void reportsWrongRowCount() {
        InvalidGridException ex = assertThrows(InvalidGridException.class, () -> GridParser.parse("abc\ndef", 3));
        assertEquals("Expected 3 rows, got 2.", ex.getMessage());
    }

    @Test
    void reportsWrongRowLength() {
        InvalidGridException ex = assertThrows(InvalidGridException.class,
                () -> GridParser.parse("abc\nde\nfgh", 3));
        assertEquals("Each row must have 3 letters. Got: 'de'", ex.getMessage());
    }

    @Test
    void reportsWrongLetterCount() {
        InvalidGridException ex = assertThrows(InvalidGridException.class, () -> GridParser.parse("abcdefgh", 3));
        assertEquals("Expected 9 letters, got 8.", ex.getMessage());
    }

    @Test
    void hugeSizeDoesNotWrapLetterCount() {
        InvalidGridException ex = assertThrows(InvalidGridException.class, () -> GridParser.parse("123", 65536));
        assertEquals("Expected 4294967296 letters, got 0.", ex.getMessage());
    }

    @Test
    void rejectsMultiLetterTiles() {
        InvalidGridException ex = assertThrows(InvalidGridException.class, () -> GridParser.parse("ab c\nd e", 2));
        assertEquals("Each tile must be a single letter. Got: 'ab'", ex.getMessage());
    }

    @Test
    void rejectsBadSlashRows() {
        assertThrows(InvalidGridException.class, () -> GridParser.parse("ab/cde", 2));
        assertThrows(InvalidGridException.class, () -> GridParser.parse("ab/cd/ef", 2));
        assertThrows(InvalidGridException.class, () -> GridParser.parse("abcd", 0));
    }

    @Test
    void infersDimensions() {
        assertEquals(Grid.of("cat", "ogx", "dxx"), GridParser.parse("cat/ogx/dxx"));
        assertEquals(Grid.of("abc", "def"), GridParser.parse("abc\ndef"));
        assertEquals(Grid.of("ab", "cd"), GridParser.parse("ABCD"));
        assertThrows(InvalidGridException.class, () -> GridParser.parse("abcde"));
        assertThrows(InvalidGridException.class, () -> GridParser.parse("ab\ncde"));
        assertThrows(InvalidGridException.class, () -> GridParser.parse(""));
    }
}
