package com.wordhunt.core.io;

import com.wordhunt.core.trie.Trie;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Reads whitespace or newline delimited word lists and keeps only tokens that the {@link Trie}
 * accepts: lowercase letters {@code a}-{@code z}, at least the requested length, first occurrence
 * only.
 */
public final class DictionaryLoader {

    private static final Logger LOGGER = Logger.getLogger(DictionaryLoader.class.getName());

    private DictionaryLoader() {
    }

    /**
     * Loads the word list stored at {@code path} as UTF-8.
     *
     * @throws UncheckedIOException if the file cannot be read
     */
    public static List<String> load(Path path, int minLength) {
        Objects.requireNonNull(path, "path");
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader, minLength);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read dictionary " + path, ex);
        }
    }

    /**
     * Extracts the words from already loaded text.
     */
    public static List<String> parse(String text, int minLength) {
        Objects.requireNonNull(text, "text");
        try {
            return read(new BufferedReader(new StringReader(text)), minLength);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    public static List<String> read(BufferedReader reader, int minLength) throws IOException {
        Objects.requireNonNull(reader, "reader");
        if (minLength < 1) {
            throw new IllegalArgumentException("minLength must be at least 1");
        }
        Set<String> words = new LinkedHashSet<>();
        long rejected = 0L;
        String line;
        while ((line = reader.readLine()) != null) {
            for (String token : line.strip().split("\\s+")) {
                if (token.isEmpty()) {
                    continue;
                }
                String word = token.toLowerCase(Locale.ROOT);
                if (word.length() >= minLength && isLetters(word)) {
                    words.add(word);
                } else {
                    rejected++;
                }
            }
        }
        final long rejectedTokens = rejected;
        LOGGER.fine(() -> String.format("Loaded %d dictionary words (%d tokens rejected)", words.size(),
                rejectedTokens));
        return new ArrayList<>(words);
    }

    /**
     * Loads the word list at {@code path} straight into a new trie.
     */
    public static Trie loadTrie(Path path, int minLength) {
        return Trie.of(load(path, minLength));
    }

    private static boolean isLetters(String word) {
        for (int i = 0; i < word.length(); i++) {
            char ch = word.charAt(i);
            if (ch < 'a' || ch > 'z') {
                return false;
            }
        }
        return true;
    }
}
