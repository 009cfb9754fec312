package com.wordhunt.core.solver;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable solve configuration passed to {@link Solver} implementations.
 *
 * @param minLength shortest word length that is reported
 * @param allowDiagonal whether diagonal neighbours are part of the adjacency
 * @param timeLimit wall-clock budget, {@link Duration#ZERO} for none
 * @param mode sequential or parallel execution
 */
public record SolveConstraints(int minLength, boolean allowDiagonal, Duration timeLimit, SolveMode mode) {

    public static final int DEFAULT_MIN_LENGTH = 3;

    public SolveConstraints {
        Objects.requireNonNull(timeLimit, "timeLimit");
        Objects.requireNonNull(mode, "mode");
        if (minLength < 1) {
            throw new IllegalArgumentException("minLength must be at least 1");
        }
        if (timeLimit.isNegative()) {
            throw new IllegalArgumentException("timeLimit must not be negative");
        }
    }

    /**
     * Minimum length three, diagonals allowed, no time limit, sequential.
     */
    public static SolveConstraints defaults() {
        return new SolveConstraints(DEFAULT_MIN_LENGTH, true, Duration.ZERO, SolveMode.SEQ);
    }

    public static SolveConstraints ofMinLength(int minLength) {
        return new SolveConstraints(minLength, true, Duration.ZERO, SolveMode.SEQ);
    }

    public SolveConstraints withMinLength(int value) {
        return new SolveConstraints(value, allowDiagonal, timeLimit, mode);
    }

    public SolveConstraints withAllowDiagonal(boolean value) {
        return new SolveConstraints(minLength, value, timeLimit, mode);
    }

    public SolveConstraints withTimeLimit(Duration value) {
        return new SolveConstraints(minLength, allowDiagonal, value, mode);
    }

    public SolveConstraints withMode(SolveMode value) {
        return new SolveConstraints(minLength, allowDiagonal, timeLimit, value);
    }

    /**
     * Execution strategy hint for {@link Solver} implementations.
     */
    public enum SolveMode {
        SEQ,
        PAR
    }
}
