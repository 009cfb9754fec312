package com.wordhunt.core.solver.parallel;

import com.wordhunt.core.Adjacency;
import com.wordhunt.core.Grid;
import com.wordhunt.core.WordPath;
import com.wordhunt.core.solver.BacktrackingSolver;
import com.wordhunt.core.solver.SolveConstraints;
import com.wordhunt.core.solver.SolveResult;
import com.wordhunt.core.solver.Solver;
import com.wordhunt.core.solver.state.SolveState;
import com.wordhunt.core.trie.Trie;
import com.wordhunt.core.trie.TrieNode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RecursiveTask;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * Parallel solver that shards starting cells across a {@link ForkJoinPool}. Every task owns its
 * {@link SolveState} and partial word map; partial maps are merged in row-major starting-cell
 * order with the first writer winning, which reproduces the sequential result exactly.
 */
public final class ForkJoinSolver implements Solver {

    private static final Logger LOGGER = Logger.getLogger(ForkJoinSolver.class.getName());

    private final ForkJoinPool pool;
    private final AtomicBoolean stopRequested = new AtomicBoolean();

    public ForkJoinSolver() {
        this(Runtime.getRuntime().availableProcessors());
    }

    public ForkJoinSolver(int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1");
        }
        this.pool = new ForkJoinPool(parallelism);
    }

    public ForkJoinSolver(ForkJoinPool pool) {
        this.pool = Objects.requireNonNull(pool, "pool");
    }

    @Override
    public void requestStop() {
        stopRequested.set(true);
    }

    /**
     * Shuts down the underlying {@link ForkJoinPool}. Has no effect on the common pool.
     */
    public void shutdown() {
        pool.shutdown();
    }

    @Override
    public SolveResult solve(Grid grid, Trie trie, SolveConstraints constraints) {
        Objects.requireNonNull(grid, "grid");
        Objects.requireNonNull(trie, "trie");
        Objects.requireNonNull(constraints, "constraints");

        long start = System.nanoTime();
        stopRequested.set(false);
        SolveContext context = new SolveContext(BacktrackingSolver.toDeadline(start, constraints.timeLimit()),
                stopRequested);
        int[][] neighbors = Adjacency.table(grid.rows(), grid.cols(), constraints.allowDiagonal());

        List<StartCellTask> tasks = new ArrayList<>(grid.cellCount());
        for (int cell = 0; cell < grid.cellCount(); cell++) {
            tasks.add(new StartCellTask(grid, neighbors, constraints.minLength(), trie.root(), cell, context));
        }
        pool.invoke(new RootTask(tasks));

        Map<String, WordPath> found = new LinkedHashMap<>();
        for (StartCellTask task : tasks) {
            for (Map.Entry<String, WordPath> entry : task.join().entrySet()) {
                found.putIfAbsent(entry.getKey(), entry.getValue());
            }
        }

        stopRequested.set(false);
        long elapsed = System.nanoTime() - start;
        boolean timedOut = context.wasAborted();
        long nodes = context.visitedNodes();
        LOGGER.fine(() -> String.format("Parallel solve of %dx%d grid: %d words, %d nodes, %.1f ms%s",
                grid.rows(), grid.cols(), found.size(), nodes, elapsed / 1_000_000.0,
                timedOut ? " (timed out)" : ""));
        return new SolveResult(found, nodes, timedOut, elapsed);
    }

    private static final class RootTask extends RecursiveTask<Void> {

        private static final long serialVersionUID = 1L;

        private final transient List<StartCellTask> tasks;

        private RootTask(List<StartCellTask> tasks) {
            this.tasks = tasks;
        }

        @Override
        protected Void compute() {
            invokeAll(tasks);
            return null;
        }
    }

    private static final class StartCellTask extends RecursiveTask<Map<String, WordPath>> {

        private static final long serialVersionUID = 1L;

        private final transient Grid grid;
        private final transient int[][] neighbors;
        private final int minLength;
        private final transient TrieNode root;
        private final int startCell;
        private final transient SolveContext context;

        private StartCellTask(Grid grid, int[][] neighbors, int minLength, TrieNode root, int startCell,
                SolveContext context) {
            this.grid = grid;
            this.neighbors = neighbors;
            this.minLength = minLength;
            this.root = root;
            this.startCell = startCell;
            this.context = context;
        }

        @Override
        protected Map<String, WordPath> compute() {
            Map<String, WordPath> partial = new LinkedHashMap<>();
            if (context.shouldAbort()) {
                return partial;
            }
            SolveState state = new SolveState(grid, neighbors, minLength, context::shouldAbort);
            state.explore(startCell, root, partial);
            context.addVisited(state.visitedNodes());
            return partial;
        }
    }

    private static final class SolveContext {
        private final long deadline;
        private final AtomicBoolean stopFlag;
        private final AtomicLong visitedNodes = new AtomicLong();
        private volatile boolean aborted;

        private SolveContext(long deadline, AtomicBoolean stopFlag) {
            this.deadline = deadline;
            this.stopFlag = stopFlag;
        }

        private boolean shouldAbort() {
            if (aborted) {
                return true;
            }
            if (stopFlag.get()) {
                aborted = true;
                return true;
            }
            if (deadline != Long.MAX_VALUE && System.nanoTime() >= deadline) {
                aborted = true;
                return true;
            }
            return false;
        }

        private void addVisited(long count) {
            visitedNodes.addAndGet(count);
        }

        private long visitedNodes() {
            return visitedNodes.get();
        }

        private boolean wasAborted() {
            return aborted;
        }
    }
}
