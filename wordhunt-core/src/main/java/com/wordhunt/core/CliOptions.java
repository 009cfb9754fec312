package com.wordhunt.core;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * Parsed command line of {@link WordHuntCLI}.
 */
public record CliOptions(
        String gridText,
        Path gridFile,
        int size,
        Path dictionary,
        int minLength,
        boolean allowDiagonal,
        int top,
        int minScore,
        boolean showPaths,
        boolean oneBased,
        boolean parallel,
        Duration timeLimit) {

    public static final int DEFAULT_SIZE = 4;
    public static final Path DEFAULT_DICTIONARY = Paths.get("wordlists", "words.txt");

    public static final String USAGE = "Usage: WordHuntCLI (--grid=<letters> | --grid-file=<path>) [--size=<n>] "
            + "[--dict=<path>] [--min-len=<n>] [--no-diagonal] [--top=<n>] [--min-score=<n>] [--paths] "
            + "[--one-based] [--parallel] [--time-limit-millis=<n>]";

    /**
     * Parses {@code --name=value} options and flags.
     *
     * @throws IllegalArgumentException on unknown options, malformed numbers or missing grid input
     */
    public static CliOptions parse(String[] args) {
        String gridText = null;
        Path gridFile = null;
        int size = DEFAULT_SIZE;
        Path dictionary = DEFAULT_DICTIONARY;
        int minLength = 3;
        boolean allowDiagonal = true;
        int top = 0;
        int minScore = 0;
        boolean showPaths = false;
        boolean oneBased = false;
        boolean parallel = false;
        long timeLimitMillis = 0L;

        for (String option : args) {
            if (option.startsWith("--grid=")) {
                gridText = valueOf(option, "--grid=");
            } else if (option.startsWith("--grid-file=")) {
                gridFile = Paths.get(valueOf(option, "--grid-file="));
            } else if (option.startsWith("--size=")) {
                size = parseInt(option, "--size=");
            } else if (option.startsWith("--dict=")) {
                dictionary = Paths.get(valueOf(option, "--dict="));
            } else if (option.startsWith("--min-len=")) {
                minLength = parseInt(option, "--min-len=");
            } else if ("--no-diagonal".equals(option)) {
                allowDiagonal = false;
            } else if (option.startsWith("--top=")) {
                top = parseInt(option, "--top=");
            } else if (option.startsWith("--min-score=")) {
                minScore = parseInt(option, "--min-score=");
            } else if ("--paths".equals(option)) {
                showPaths = true;
            } else if ("--one-based".equals(option)) {
                oneBased = true;
            } else if ("--parallel".equals(option)) {
                parallel = true;
            } else if (option.startsWith("--time-limit-millis=")) {
                timeLimitMillis = Long.parseLong(valueOf(option, "--time-limit-millis="));
            } else {
                throw new IllegalArgumentException("Unrecognised argument: " + option);
            }
        }

        if (gridText == null && gridFile == null) {
            throw new IllegalArgumentException("Provide either --grid or --grid-file");
        }
        if (size < 1) {
            throw new IllegalArgumentException("size must be at least 1");
        }
        if (minLength < 1) {
            throw new IllegalArgumentException("min-len must be at least 1");
        }
        if (timeLimitMillis < 0L) {
            throw new IllegalArgumentException("time-limit-millis must be non-negative");
        }
        return new CliOptions(gridText, gridFile, size, dictionary, minLength, allowDiagonal, top, minScore,
                showPaths, oneBased, parallel, Duration.ofMillis(timeLimitMillis));
    }

    private static String valueOf(String option, String prefix) {
        return option.substring(prefix.length());
    }

    private static int parseInt(String option, String prefix) {
        return Integer.parseInt(valueOf(option, prefix));
    }
}
