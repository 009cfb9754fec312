package com.wordhunt.core.io;

import com.wordhunt.core.Grid;
import com.wordhunt.core.result.ResultEntry;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Plain-text rendering of boards and ranked results for the console.
 */
public final class ResultFormatter {

    private ResultFormatter() {
    }

    /**
     * Renders the board in upper case with one-based row and column labels.
     */
    public static String formatBoard(Grid grid) {
        Objects.requireNonNull(grid, "grid");
        StringBuilder builder = new StringBuilder("Board:").append(System.lineSeparator());
        for (int row = 0; row < grid.rows(); row++) {
            builder.append(row + 1).append(':');
            for (int col = 0; col < grid.cols(); col++) {
                builder.append(' ').append(Character.toUpperCase(grid.letterAt(row, col)));
            }
            builder.append(System.lineSeparator());
        }
        builder.append("  ");
        for (int col = 0; col < grid.cols(); col++) {
            builder.append(' ').append(col + 1);
        }
        return builder.append(System.lineSeparator()).toString();
    }

    /**
     * Renders one entry as {@code score  word (length)}, followed by its path when requested.
     */
    public static String formatEntry(ResultEntry entry, boolean showPath, boolean oneBased) {
        Objects.requireNonNull(entry, "entry");
        String line = String.format(Locale.ROOT, "%2d  %s (%d)", entry.score(), entry.word(), entry.length());
        return showPath ? line + "  " + entry.path().format(oneBased) : line;
    }

    public static String formatEntries(List<ResultEntry> entries, boolean showPath, boolean oneBased) {
        Objects.requireNonNull(entries, "entries");
        StringBuilder builder = new StringBuilder();
        for (ResultEntry entry : entries) {
            builder.append(formatEntry(entry, showPath, oneBased)).append(System.lineSeparator());
        }
        return builder.toString();
    }

    public static String formatSummary(int foundCount, int minLength, Grid grid) {
        Objects.requireNonNull(grid, "grid");
        return String.format(Locale.ROOT, "Found %d words (min_len=%d, size=%dx%d).", foundCount, minLength,
                grid.rows(), grid.cols());
    }
}
