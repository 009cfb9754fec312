package com.wordhunt.visualizer.task;

import com.wordhunt.core.Grid;
import com.wordhunt.core.io.DictionaryLoader;
import com.wordhunt.core.result.ResultAssembler;
import com.wordhunt.core.result.ResultEntry;
import com.wordhunt.core.solver.SolveConstraints;
import com.wordhunt.core.solver.SolveResult;
import com.wordhunt.core.solver.Solver;
import com.wordhunt.core.trie.Trie;
import com.wordhunt.visualizer.model.SolveFrame;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import javafx.application.Platform;
import javafx.concurrent.Task;

/**
 * Background task that loads the dictionary when needed, builds the trie, solves the grid and
 * ranks the results.
 */
public final class SolveTask extends Task<SolveFrame> {

    private static final int STEPS = 4;

    private final Solver solver;
    private final Grid grid;
    private final DictionarySource dictionary;
    private final Trie cachedTrie;
    private final SolveConstraints constraints;
    private final int minScore;
    private final int topN;

    /**
     * @param cachedTrie trie previously built from the same dictionary source, or {@code null}
     */
    public SolveTask(Solver solver, Grid grid, DictionarySource dictionary, Trie cachedTrie,
            SolveConstraints constraints, int minScore, int topN) {
        this.solver = Objects.requireNonNull(solver, "solver");
        this.grid = Objects.requireNonNull(grid, "grid");
        this.dictionary = Objects.requireNonNull(dictionary, "dictionary");
        this.cachedTrie = cachedTrie;
        this.constraints = Objects.requireNonNull(constraints, "constraints");
        this.minScore = minScore;
        this.topN = topN;
    }

    @Override
    protected SolveFrame call() {
        boolean onFxThread;
        try {
            onFxThread = Platform.isFxApplicationThread();
        } catch (IllegalStateException ex) {
            onFxThread = false;
        }
        if (onFxThread) {
            throw new IllegalStateException("Solving must not run on the JavaFX application thread");
        }

        Trie trie = cachedTrie;
        if (trie == null) {
            updateMessage("Loading dictionary...");
            updateProgress(0, STEPS);
            List<String> words = dictionary.load(constraints.minLength());

            updateMessage(String.format("Building trie (%,d words)...", words.size()));
            updateProgress(1, STEPS);
            trie = Trie.of(words);
        }
        if (isCancelled()) {
            updateMessage("Cancelled");
            return null;
        }

        updateMessage("Solving...");
        updateProgress(2, STEPS);
        SolveResult result = solver.solve(grid, trie, constraints);
        if (isCancelled()) {
            return null;
        }

        updateProgress(3, STEPS);
        List<ResultEntry> entries = ResultAssembler.assemble(result.words(), minScore, topN);

        updateMessage(String.format("Found %,d words. Showing %,d.%s", result.wordCount(), entries.size(),
                result.timedOut() ? " (time limit reached)" : ""));
        updateProgress(STEPS, STEPS);
        return new SolveFrame(grid, trie, dictionary.label(), result, entries, constraints.minLength());
    }

    /**
     * Cancels the task and asks the solver to unwind a solve that is already running.
     */
    @Override
    public boolean cancel(boolean mayInterruptIfRunning) {
        boolean cancelled = super.cancel(mayInterruptIfRunning);
        if (cancelled) {
            solver.requestStop();
        }
        return cancelled;
    }

    /**
     * Where the word list comes from: a file chosen by the user or text pasted into the window.
     */
    public record DictionarySource(Path file, String pastedText) {

        public static DictionarySource ofFile(Path file) {
            return new DictionarySource(Objects.requireNonNull(file, "file"), null);
        }

        public static DictionarySource ofText(String text) {
            return new DictionarySource(null, Objects.requireNonNull(text, "text"));
        }

        public List<String> load(int minLength) {
            return file != null
                    ? DictionaryLoader.load(file, minLength)
                    : DictionaryLoader.parse(pastedText, minLength);
        }

        public String label() {
            return file != null ? file.getFileName().toString() : "pasted words";
        }
    }
}
