package com.wordhunt.core.solver;

import com.wordhunt.core.Adjacency;
import com.wordhunt.core.Grid;
import com.wordhunt.core.WordPath;
import com.wordhunt.core.solver.parallel.ForkJoinSolver;
import com.wordhunt.core.solver.state.SolveState;
import com.wordhunt.core.trie.Trie;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;
import java.util.logging.Logger;

/**
 * Exhaustive trie-guided depth-first search from every cell in row-major order. The first path
 * found for a word is kept, so the reported path depends on the starting-cell order and on the
 * neighbour order of {@link Adjacency}.
 */
public final class BacktrackingSolver implements Solver {

    private static final Logger LOGGER = Logger.getLogger(BacktrackingSolver.class.getName());

    private final AtomicBoolean stopRequested = new AtomicBoolean();
    private volatile ForkJoinSolver parallelSolver;
    private long lastVisitedNodes;
    private boolean lastTimedOut;

    /**
     * Solves with default constraints and the provided minimum word length.
     */
    public Map<String, WordPath> solve(Grid grid, Trie trie, int minLength) {
        return solve(grid, trie, SolveConstraints.ofMinLength(minLength)).words();
    }

    @Override
    public SolveResult solve(Grid grid, Trie trie, SolveConstraints constraints) {
        Objects.requireNonNull(grid, "grid");
        Objects.requireNonNull(trie, "trie");
        Objects.requireNonNull(constraints, "constraints");

        SolveResult result = constraints.mode() == SolveConstraints.SolveMode.PAR
                ? getParallelSolver().solve(grid, trie, constraints)
                : solveSequential(grid, trie, constraints);

        lastVisitedNodes = result.visitedNodes();
        lastTimedOut = result.timedOut();
        return result;
    }

    @Override
    public void requestStop() {
        stopRequested.set(true);
        ForkJoinSolver delegate = parallelSolver;
        if (delegate != null) {
            delegate.requestStop();
        }
    }

    public long getLastVisitedNodeCount() {
        return lastVisitedNodes;
    }

    public boolean wasLastSolveTimedOut() {
        return lastTimedOut;
    }

    private SolveResult solveSequential(Grid grid, Trie trie, SolveConstraints constraints) {
        long start = System.nanoTime();
        stopRequested.set(false);
        long deadline = toDeadline(start, constraints.timeLimit());
        BooleanSupplier stopCheck = deadline == Long.MAX_VALUE
                ? stopRequested::get
                : () -> stopRequested.get() || System.nanoTime() >= deadline;

        int[][] neighbors = Adjacency.table(grid.rows(), grid.cols(), constraints.allowDiagonal());
        SolveState state = new SolveState(grid, neighbors, constraints.minLength(), stopCheck);
        Map<String, WordPath> found = new LinkedHashMap<>();
        for (int cell = 0; cell < grid.cellCount(); cell++) {
            if (!state.explore(cell, trie.root(), found)) {
                break;
            }
        }

        stopRequested.set(false);
        long elapsed = System.nanoTime() - start;
        boolean timedOut = state.isAborted();
        LOGGER.fine(() -> String.format("Solved %dx%d grid: %d words, %d nodes, %.1f ms%s",
                grid.rows(), grid.cols(), found.size(), state.visitedNodes(), elapsed / 1_000_000.0,
                timedOut ? " (timed out)" : ""));
        return new SolveResult(found, state.visitedNodes(), timedOut, elapsed);
    }

    private ForkJoinSolver getParallelSolver() {
        if (parallelSolver == null) {
            parallelSolver = new ForkJoinSolver(ForkJoinPool.commonPool());
        }
        return parallelSolver;
    }

    /**
     * Converts a time limit into an absolute {@link System#nanoTime()} deadline, or
     * {@link Long#MAX_VALUE} when the limit is zero.
     */
    public static long toDeadline(long start, Duration timeLimit) {
        if (timeLimit.isZero()) {
            return Long.MAX_VALUE;
        }
        long nanos = Math.max(1L, timeLimit.toNanos());
        long result = start + nanos;
        if (((start ^ result) & (nanos ^ result)) < 0) {
            return Long.MAX_VALUE;
        }
        return result;
    }
}
