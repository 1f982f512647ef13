package com.sbe.application.service.solver;

import com.sbe.domain.model.Batch;
import com.sbe.domain.model.Chunk;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs the solver on a worker thread under a wall-clock budget.
 *
 * When the budget elapses the returned future fails with {@link SolverTimeoutException},
 * the solver is asked to stop, and whatever it returns later is discarded.
 */
@Slf4j
public class SolverInvoker {

    private final Vertx vertx;
    private final BatchSolver solver;
    private final Duration timeBudget;

    public SolverInvoker(Vertx vertx, BatchSolver solver, Duration timeBudget) {
        if (timeBudget.toMillis() < 1) {
            throw new IllegalArgumentException("Solver time budget must be at least 1ms: " + timeBudget);
        }
        this.vertx = vertx;
        this.solver = solver;
        this.timeBudget = timeBudget;
    }

    public Future<List<Batch>> solve(Chunk chunk) {
        Promise<List<Batch>> promise = Promise.promise();
        AtomicBoolean cancelled = new AtomicBoolean();

        long timerId = vertx.setTimer(timeBudget.toMillis(), id -> {
            cancelled.set(true);
            if (promise.tryFail(new SolverTimeoutException(chunk.getChunkId(), timeBudget))) {
                log.warn("Solver timed out after {}ms for chunk {}", timeBudget.toMillis(), chunk.getChunkId());
            }
        });

        vertx.<List<Batch>>executeBlocking(() -> solver.solve(chunk, cancelled::get), false)
                .onComplete(ar -> {
                    vertx.cancelTimer(timerId);
                    if (ar.succeeded()) {
                        if (!promise.tryComplete(ar.result())) {
                            log.debug("Discarding late solver result for chunk {}", chunk.getChunkId());
                        }
                    } else if (!cancelled.get()) {
                        Throwable cause = ar.cause();
                        promise.tryFail(cause instanceof SolverFailureException
                                ? cause
                                : new SolverFailureException(chunk.getChunkId(), "Solver failed: " + cause.getMessage(), cause));
                    }
                });

        return promise.future();
    }
}
