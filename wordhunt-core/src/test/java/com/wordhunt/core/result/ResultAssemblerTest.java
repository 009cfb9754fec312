package com.wordhunt.core.result;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.wordhunt.core.Cell;
import com.wordhunt.core.WordPath;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ResultAssemblerTest {

    private static Map<String, WordPath> found(String... words) {
        Map<String, WordPath> found = new LinkedHashMap<>();
        for (String word : words) {
            found.put(word, straightPath(word.length()));
        }
        return found;
    }

    private static WordPath straightPath(int length) {
        List<Cell> cells = new ArrayList<>();
        for (int col = 0; col < length; col++) {
            cells.add(new Cell(0, col));
        }
        return new WordPath(cells);
    }

    private static List<String> words(List<ResultEntry> entries) {
        List<String> words = new ArrayList<>();
        for (ResultEntry entry : entries) {
            words.add(entry.word());
        }
        return words;
    }

    @Test
    void ranksByScoreThenLengthThenWord() {
        List<ResultEntry> entries = ResultAssembler.assemble(found("cat", "tree", "bee", "planets", "an"), 0, 0);

        assertEquals(List.of("planets", "tree", "bee", "cat", "an"), words(entries));
        assertEquals(5, entries.get(0).score());
        assertEquals(0, entries.get(4).score());
    }

    @Test
    void minScoreDropsLowEntries() {
        Map<String, WordPath> found = found("cat", "tree", "bee", "planets", "an");

        assertEquals(List.of("planets", "tree", "bee", "cat"), words(ResultAssembler.assemble(found, 1, 0)));
        assertEquals(List.of("planets"), words(ResultAssembler.assemble(found, 2, 0)));
    }

    @Test
    void topNTruncatesAfterSorting() {
        Map<String, WordPath> found = found("cat", "tree", "bee", "planets");

        assertEquals(List.of("planets", "tree"), words(ResultAssembler.assemble(found, 0, 2)));
        assertEquals(4, ResultAssembler.assemble(found, 0, 10).size());
        assertEquals(4, ResultAssembler.assemble(found, 0, -1).size());
    }

    @Test
    void longerWordBeatsAlphabeticalOrderOnTies() {
        List<ResultEntry> entries = List.of(
                new ResultEntry("tree", 3, straightPath(4)),
                new ResultEntry("cat", 1, straightPath(3)),
                new ResultEntry("bee", 1, straightPath(3)));

        assertEquals(List.of("tree", "bee", "cat"), words(ResultAssembler.rank(entries, 0)));
    }

    @Test
    void rankOrdersPrescoredEntries() {
        List<ResultEntry> entries = List.of(
                new ResultEntry("bee", 1, straightPath(3)),
                new ResultEntry("cat", 1, straightPath(3)),
                new ResultEntry("trees", 2, straightPath(5)),
                new ResultEntry("tree", 1, straightPath(4)));

        assertEquals(List.of("trees", "tree", "bee", "cat"), words(ResultAssembler.rank(entries, 0)));
    }

    @Test
    void keepsPathWithEntry() {
        List<ResultEntry> entries = ResultAssembler.assemble(found("cat"), 0, 0);

        assertEquals(straightPath(3), entries.get(0).path());
        assertEquals(3, entries.get(0).length());
    }

    @Test
    void resultListIsImmutable() {
        List<ResultEntry> entries = ResultAssembler.assemble(found("cat"), 0, 0);

        assertThrows(UnsupportedOperationException.class, entries::clear);
    }
}
