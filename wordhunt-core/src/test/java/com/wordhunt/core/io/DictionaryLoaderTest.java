package com.wordhunt.core.io;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.wordhunt.core.trie.Trie;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DictionaryLoaderTest {

    private static final String WORD_LIST = "Cat\ndog bird\n\n  a1b  \nDOG\nab\n";

    @TempDir
    Path tempDir;

    @Test
    void keepsFirstOccurrenceOfValidWords() {
        assertEquals(List.of("cat", "dog", "bird"), DictionaryLoader.parse(WORD_LIST, 3));
    }

    @Test
    void minLengthFiltersShortWords() {
        assertEquals(List.of("cat", "dog", "bird", "ab"), DictionaryLoader.parse(WORD_LIST, 2));
        assertEquals(List.of("bird"), DictionaryLoader.parse(WORD_LIST, 4));
    }

    @Test
    void rejectsNonAsciiLetters() {
        assertEquals(List.of("cafe"), DictionaryLoader.parse("café cafe naïve don't", 3));
    }

    @Test
    void loadsFromFile() throws Exception {
        Path file = tempDir.resolve("words.txt");
        Files.writeString(file, WORD_LIST, StandardCharsets.UTF_8);

        assertEquals(List.of("cat", "dog", "bird"), DictionaryLoader.load(file, 3));

        Trie trie = DictionaryLoader.loadTrie(file, 3);
        assertEquals(3, trie.size());
        assertTrue(trie.contains("bird"));
    }

    @Test
    void missingFileFailsWithUncheckedException() {
        Path missing = tempDir.resolve("missing.txt");

        assertThrows(UncheckedIOException.class, () -> DictionaryLoader.load(missing, 3));
    }

    @Test
    void rejectsNonPositiveMinLength() {
        assertThrows(IllegalArgumentException.class, () -> DictionaryLoader.parse("cat", 0));
    }
}
