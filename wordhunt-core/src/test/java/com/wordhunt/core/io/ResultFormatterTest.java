package com.wordhunt.core.io;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.wordhunt.core.Grid;
import com.wordhunt.core.WordPath;
import com.wordhunt.core.result.ResultEntry;
import java.util.List;
import org.junit.jupiter.api.Test;

class ResultFormatterTest {

    private static final String NL = System.lineSeparator();
    private static final ResultEntry CAT = new ResultEntry("cat", 1, WordPath.fromIndices(new int[] {0, 1, 2}, 3, 3));

    @Test
    void boardUsesUpperCaseAndOneBasedLabels() {
        String board = ResultFormatter.formatBoard(Grid.of("ab", "cd"));

        assertEquals("Board:" + NL + "1: A B" + NL + "2: C D" + NL + "   1 2" + NL, board);
    }

    @Test
    void entryWithoutPath() {
        assertEquals(" 1  cat (3)", ResultFormatter.formatEntry(CAT, false, false));
    }

    @Test
    void entryWithZeroAndOneBasedPath() {
        assertEquals(" 1  cat (3)  (0,0)->(0,1)->(0,2)", ResultFormatter.formatEntry(CAT, true, false));
        assertEquals(" 1  cat (3)  (1,1)->(1,2)->(1,3)", ResultFormatter.formatEntry(CAT, true, true));
    }

    @Test
    void wideScoresKeepAlignment() {
        ResultEntry entry = new ResultEntry("abcdefgh", 11,
                WordPath.fromIndices(new int[] {0, 1, 2, 3, 7, 6, 5, 4}, 8, 4));

        assertEquals("11  abcdefgh (8)", ResultFormatter.formatEntry(entry, false, false));
    }

    @Test
    void entriesAreOnePerLine() {
        ResultEntry tag = new ResultEntry("tag", 1, WordPath.fromIndices(new int[] {2, 1, 4}, 3, 3));

        assertEquals(" 1  cat (3)" + NL + " 1  tag (3)" + NL,
                ResultFormatter.formatEntries(List.of(CAT, tag), false, false));
        assertEquals("", ResultFormatter.formatEntries(List.of(), true, true));
    }

    @Test
    void summaryNamesCountAndSize() {
        assertEquals("Found 2 words (min_len=3, size=3x3).",
                ResultFormatter.formatSummary(2, 3, Grid.of("cat", "ogx", "dxx")));
    }
}
