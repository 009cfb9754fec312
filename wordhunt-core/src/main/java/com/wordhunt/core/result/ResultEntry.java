package com.wordhunt.core.result;

import com.wordhunt.core.WordPath;
import java.util.Objects;

/**
 * A scored word together with the path that spells it.
 */
public record ResultEntry(String word, int score, WordPath path) {

    public ResultEntry {
        Objects.requireNonNull(word, "word");
        Objects.requireNonNull(path, "path");
    }

    public int length() {
        return word.length();
    }
}
