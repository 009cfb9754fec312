package com.wordhunt.core.io;

import com.wordhunt.core.Grid;
import com.wordhunt.core.InvalidGridException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Parses grid text typed by a user. Four layouts are accepted:
 * <ul>
 *     <li>multiline rows of letters, {@code rnsm\ntduo\nrasa\nethh}</li>
 *     <li>multiline rows of space separated letters, {@code r n s m\nt d u o\n...}</li>
 *     <li>slash separated rows, {@code r n s m / t d u o / ...} or {@code rnsm/tduo/...}</li>
 *     <li>a compact string of all letters, {@code rnsmtduorasaethh}</li>
 * </ul>
 * Input is trimmed and lower-cased; in letter layouts anything that is not {@code a}-{@code z} is
 * dropped.
 */
public final class GridParser {

    private GridParser() {
    }

    /**
     * Parses a square {@code size x size} grid.
     *
     * @throws InvalidGridException if the row count, a row length or the letter count is wrong
     */
    public static Grid parse(String text, int size) {
        Objects.requireNonNull(text, "text");
        if (size < 1) {
            throw new InvalidGridException("Grid size must be positive: " + size);
        }
        String normalized = text.strip().toLowerCase(Locale.ROOT);

        if (normalized.indexOf('\n') >= 0) {
            List<String> lines = nonBlankLines(normalized);
            if (lines.size() != size) {
                throw new InvalidGridException("Expected " + size + " rows, got " + lines.size() + ".");
            }
            List<String> rows = new ArrayList<>(size);
            for (String line : lines) {
                String row = line.indexOf(' ') >= 0 ? joinTokens(line) : lettersOnly(line);
                if (row.length() != size) {
                    throw new InvalidGridException("Each row must have " + size + " letters. Got: '" + line + "'");
                }
                rows.add(row);
            }
            return Grid.of(rows);
        }

        if (normalized.indexOf('/') >= 0) {
            List<String> rows = new ArrayList<>(size);
            for (String part : normalized.split("/", -1)) {
                String segment = part.strip();
                String[] tokens = tokens(segment);
                String row;
                if (tokens.length == size) {
                    row = joinTokens(segment);
                } else {
                    row = lettersOnly(segment);
                    if (row.length() != size) {
                        throw new InvalidGridException("Expected " + size
                                + " letters per row in slash format. Got: '" + segment + "'");
                    }
                }
                rows.add(row);
            }
            if (rows.size() != size) {
                throw new InvalidGridException("Expected " + size + " rows in slash format, got " + rows.size() + ".");
            }
            return Grid.of(rows);
        }

        String compact = lettersOnly(normalized);
        long expected = (long) size * size;
        if (compact.length() != expected) {
            throw new InvalidGridException("Expected " + expected + " letters, got " + compact.length() + ".");
        }
        return Grid.of(size, size, compact);
    }

    /**
     * Parses a grid whose dimensions are inferred: rows from multiline or slash input, or a square
     * from compact input whose length is a perfect square.
     */
    public static Grid parse(String text) {
        Objects.requireNonNull(text, "text");
        String normalized = text.strip().toLowerCase(Locale.ROOT);
        List<String> segments;
        if (normalized.indexOf('\n') >= 0) {
            segments = nonBlankLines(normalized);
        } else if (normalized.indexOf('/') >= 0) {
            segments = new ArrayList<>();
            for (String part : normalized.split("/", -1)) {
                segments.add(part.strip());
            }
        } else {
            String compact = lettersOnly(normalized);
            int size = (int) Math.round(Math.sqrt(compact.length()));
            if (compact.isEmpty() || size * size != compact.length()) {
                throw new InvalidGridException("Cannot infer a square grid from " + compact.length() + " letters.");
            }
            return Grid.of(size, size, compact);
        }
        List<String> rows = new ArrayList<>(segments.size());
        for (String segment : segments) {
            rows.add(segment.indexOf(' ') >= 0 ? joinTokens(segment) : lettersOnly(segment));
        }
        return Grid.of(rows);
    }

    private static List<String> nonBlankLines(String text) {
        List<String> lines = new ArrayList<>();
        for (String line : text.split("\\R")) {
            String stripped = line.strip();
            if (!stripped.isEmpty()) {
                lines.add(stripped);
            }
        }
        return lines;
    }

    private static String[] tokens(String segment) {
        return segment.isEmpty() ? new String[0] : segment.split("\\s+");
    }

    private static String joinTokens(String segment) {
        StringBuilder builder = new StringBuilder();
        for (String token : tokens(segment)) {
            if (token.length() != 1) {
                throw new InvalidGridException("Each tile must be a single letter. Got: '" + token + "'");
            }
            builder.append(token);
        }
        return builder.toString();
    }

    private static String lettersOnly(String text) {
        StringBuilder builder = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch >= 'a' && ch <= 'z') {
                builder.append(ch);
            }
        }
        return builder.toString();
    }
}
