package com.sbe.application.service.solver;

import java.time.Duration;

/**
 * The solver did not finish within its time budget
 */
public class SolverTimeoutException extends SolverFailureException {

    public SolverTimeoutException(String chunkId, Duration budget) {
        super(chunkId, "Solver exceeded its " + budget.toMillis() + "ms budget for chunk " + chunkId);
    }

    public SolverTimeoutException(String chunkId) {
        super(chunkId, "Solver cancelled for chunk " + chunkId);
    }
}
