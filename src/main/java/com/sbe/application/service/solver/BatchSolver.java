package com.sbe.application.service.solver;

import com.sbe.domain.model.Batch;
import com.sbe.domain.model.Chunk;

import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Partitions a chunk into batches.
 *
 * Implementations run on a worker thread and must poll {@code cancelled} often enough to
 * stop soon after the caller gives up on them.
 */
public interface BatchSolver {

    /**
     * @return batches covering every chunk member exactly once; members that cannot be
     *         batched this cycle go into a single INFEASIBLE batch
     * @throws SolverFailureException if no assignment could be produced, or the search was cancelled
     */
    List<Batch> solve(Chunk chunk, BooleanSupplier cancelled) throws SolverFailureException;
}
