package com.wordhunt.core.solver;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class SolveConstraintsTest {

    @Test
    void defaultsMatchConsoleDefaults() {
        SolveConstraints constraints = SolveConstraints.defaults();

        assertEquals(3, constraints.minLength());
        assertTrue(constraints.allowDiagonal());
        assertEquals(Duration.ZERO, constraints.timeLimit());
        assertSame(SolveConstraints.SolveMode.SEQ, constraints.mode());
    }

    @Test
    void withersReplaceSingleField() {
        SolveConstraints constraints = SolveConstraints.defaults()
                .withMinLength(4)
                .withAllowDiagonal(false)
                .withTimeLimit(Duration.ofMillis(5))
                .withMode(SolveConstraints.SolveMode.PAR);

        assertEquals(new SolveConstraints(4, false, Duration.ofMillis(5), SolveConstraints.SolveMode.PAR),
                constraints);
    }

    @Test
    void rejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> SolveConstraints.ofMinLength(0));
        assertThrows(IllegalArgumentException.class,
                () -> SolveConstraints.defaults().withTimeLimit(Duration.ofMillis(-1)));
        assertThrows(NullPointerException.class, () -> SolveConstraints.defaults().withMode(null));
    }
}
