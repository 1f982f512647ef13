package com.sbe.application.service.solver;

import java.util.function.BooleanSupplier;

/**
 * Node allowance and cancellation check shared by every search of one solve call
 */
final class SearchBudget {

    private static final int CANCEL_CHECK_MASK = 1023;

    private final String chunkId;
    private final BooleanSupplier cancelled;
    private long remainingNodes;
    private long visited;

    SearchBudget(String chunkId, long maxNodes, BooleanSupplier cancelled) {
        this.chunkId = chunkId;
        this.remainingNodes = maxNodes;
        this.cancelled = cancelled;
    }

    /**
     * Account for one search node.
     *
     * @return false once the node allowance is used up
     */
    boolean visit() throws SolverTimeoutException {
        visited++;
        if ((visited & CANCEL_CHECK_MASK) == 0) {
            checkCancelled();
        }
        if (remainingNodes <= 0) {
            return false;
        }
        remainingNodes--;
        return true;
    }

    boolean isExhausted() {
        return remainingNodes <= 0;
    }

    long visited() {
        return visited;
    }

    void checkCancelled() throws SolverTimeoutException {
        if (cancelled.getAsBoolean()) {
            throw new SolverTimeoutException(chunkId);
        }
    }
}
