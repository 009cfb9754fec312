package com.wordhunt.core.trie;

/**
 * One prefix position of a {@link Trie}. Children are keyed by letter {@code a}-{@code z} and
 * created lazily while words are inserted.
 */
public final class TrieNode {

    static final int ALPHABET_SIZE = 26;

    private final TrieNode[] children = new TrieNode[ALPHABET_SIZE];
    private boolean word;
    private int childCount;

    TrieNode() {
    }

    /**
     * Returns the child for the provided letter or {@code null} if no dictionary word continues
     * with it. Letters outside {@code a}-{@code z} never have a child.
     */
    public TrieNode child(char letter) {
        int slot = letter - 'a';
        if (slot < 0 || slot >= ALPHABET_SIZE) {
            return null;
        }
        return children[slot];
    }

    /**
     * Returns {@code true} if the prefix ending at this node is a complete dictionary word.
     */
    public boolean isWord() {
        return word;
    }

    public boolean hasChildren() {
        return childCount > 0;
    }

    public int childCount() {
        return childCount;
    }

    TrieNode childOrCreate(char letter) {
        int slot = letter - 'a';
        TrieNode child = children[slot];
        if (child == null) {
            child = new TrieNode();
            children[slot] = child;
            childCount++;
        }
        return child;
    }

    boolean markWord() {
        boolean added = !word;
        word = true;
        return added;
    }
}
