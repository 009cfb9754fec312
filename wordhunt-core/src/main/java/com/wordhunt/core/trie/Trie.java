package com.wordhunt.core.trie;

import java.util.Objects;

/**
 * Prefix tree over lowercase ASCII words. The trie is filled once and then only read, so a built
 * instance may be shared by any number of concurrent solves as long as no insertion runs at the
 * same time.
 */
public final class Trie {

    private final TrieNode root = new TrieNode();
    private int size;
    private int nodeCount = 1;

    public Trie() {
    }

    /**
     * Builds a trie containing every provided word.
     *
     * @throws InvalidDictionaryWordException if any word is empty or not made of {@code a}-{@code z}
     */
    public static Trie of(Iterable<String> words) {
        Objects.requireNonNull(words, "words");
        Trie trie = new Trie();
        for (String word : words) {
            trie.insert(word);
        }
        return trie;
    }

    public static Trie of(String... words) {
        Objects.requireNonNull(words, "words");
        Trie trie = new Trie();
        for (String word : words) {
            trie.insert(word);
        }
        return trie;
    }

    /**
     * Inserts a word. Inserting a word that is already present has no effect.
     *
     * @return {@code true} if the word was not present before
     * @throws InvalidDictionaryWordException if the word is empty or not made of {@code a}-{@code z}
     */
    public boolean insert(String word) {
        validate(word);
        TrieNode node = root;
        for (int i = 0; i < word.length(); i++) {
            int before = node.childCount();
            TrieNode parent = node;
            node = node.childOrCreate(word.charAt(i));
            nodeCount += parent.childCount() - before;
        }
        boolean added = node.markWord();
        if (added) {
            size++;
        }
        return added;
    }

    public TrieNode root() {
        return root;
    }

    /**
     * Returns {@code true} if the exact word was inserted.
     */
    public boolean contains(String word) {
        TrieNode node = find(word);
        return node != null && node.isWord();
    }

    /**
     * Returns {@code true} if some inserted word starts with the provided prefix. The empty prefix
     * matches as soon as the trie is non-empty.
     */
    public boolean containsPrefix(String prefix) {
        TrieNode node = find(prefix);
        return node != null && (node.isWord() || node.hasChildren());
    }

    /**
     * Returns the number of distinct words.
     */
    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * Returns the number of nodes including the root.
     */
    public int nodeCount() {
        return nodeCount;
    }

    private TrieNode find(String text) {
        Objects.requireNonNull(text, "text");
        TrieNode node = root;
        for (int i = 0; i < text.length() && node != null; i++) {
            node = node.child(text.charAt(i));
        }
        return node;
    }

    private static void validate(String word) {
        if (word == null) {
            throw new InvalidDictionaryWordException(null, "Dictionary word must not be null");
        }
        if (word.isEmpty()) {
            throw new InvalidDictionaryWordException(word, "Dictionary word must not be empty");
        }
        for (int i = 0; i < word.length(); i++) {
            char letter = word.charAt(i);
            if (letter < 'a' || letter > 'z') {
                throw new InvalidDictionaryWordException(word, "Dictionary word must contain only a-z");
            }
        }
    }
}
