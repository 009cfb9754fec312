package com.wordhunt.core.trie;

/**
 * Thrown when a word offered to the {@link Trie} is empty or contains anything other than the
 * letters {@code a} to {@code z}.
 */
public class InvalidDictionaryWordException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final String word;

    public InvalidDictionaryWordException(String word, String reason) {
        super(reason + ": " + (word == null ? "null" : "\"" + word + "\""));
        this.word = word;
    }

    public String getWord() {
        return word;
    }
}
