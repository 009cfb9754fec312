package com.wordhunt.core;

import com.wordhunt.core.io.DictionaryLoader;
import com.wordhunt.core.io.GridParser;
import com.wordhunt.core.io.ResultFormatter;
import com.wordhunt.core.result.ResultAssembler;
import com.wordhunt.core.result.ResultEntry;
import com.wordhunt.core.solver.BacktrackingSolver;
import com.wordhunt.core.solver.SolveConstraints;
import com.wordhunt.core.solver.SolveResult;
import com.wordhunt.core.trie.Trie;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Console front-end: parses a grid, loads a word list, solves and prints the ranked words.
 */
public final class WordHuntCLI {

    private static final Logger LOGGER = Logger.getLogger(WordHuntCLI.class.getName());
    private static final String LOGGING_CONFIG = "/wordhunt-logging.properties";

    private WordHuntCLI() {
    }

    public static void main(String[] args) {
        configureLogging();
        int status = run(args, System.out, System.err);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Runs the solver for the provided arguments and returns the process exit status.
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        CliOptions options;
        try {
            options = CliOptions.parse(args);
        } catch (IllegalArgumentException ex) {
            err.println(ex.getMessage());
            err.println(CliOptions.USAGE);
            return 2;
        }

        if (!Files.exists(options.dictionary())) {
            err.println("Dictionary file not found: " + options.dictionary());
            err.println("Add one at that path, or pass --dict=/path/to/wordlist.txt");
            return 1;
        }

        try {
            String gridInput = options.gridFile() != null
                    ? Files.readString(options.gridFile(), StandardCharsets.UTF_8)
                    : options.gridText();
            Grid grid = GridParser.parse(gridInput, options.size());
            out.println();
            out.println(ResultFormatter.formatBoard(grid));

            List<String> words = DictionaryLoader.load(options.dictionary(), options.minLength());
            Trie trie = Trie.of(words);

            SolveConstraints constraints = new SolveConstraints(options.minLength(), options.allowDiagonal(),
                    options.timeLimit(), options.parallel()
                            ? SolveConstraints.SolveMode.PAR
                            : SolveConstraints.SolveMode.SEQ);
            SolveResult result = new BacktrackingSolver().solve(grid, trie, constraints);
            if (result.timedOut()) {
                err.println("Time limit reached; results are incomplete.");
            }

            List<ResultEntry> entries = ResultAssembler.assemble(result.words(), options.minScore(), options.top());
            out.print(ResultFormatter.formatEntries(entries, options.showPaths(), options.oneBased()));
            out.println();
            out.println(ResultFormatter.formatSummary(result.wordCount(), options.minLength(), grid));
            return 0;
        } catch (InvalidGridException ex) {
            err.println("Invalid grid: " + ex.getMessage());
            return 1;
        } catch (IOException | UncheckedIOException ex) {
            LOGGER.log(Level.SEVERE, "Failed to read input", ex);
            err.println("Failed to read input: " + ex.getMessage());
            return 1;
        }
    }

    private static void configureLogging() {
        try (InputStream config = WordHuntCLI.class.getResourceAsStream(LOGGING_CONFIG)) {
            if (config != null) {
                LogManager.getLogManager().readConfiguration(config);
            }
        } catch (IOException ex) {
            LOGGER.log(Level.WARNING, "Failed to read logging configuration", ex);
        }
    }
}
