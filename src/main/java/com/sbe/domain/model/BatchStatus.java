package com.sbe.domain.model;

/**
 * Optimization status of a batch
 */
public enum BatchStatus {
    OPTIMAL,
    FALLBACK,
    INFEASIBLE;

    public boolean isNettable() {
        return this != INFEASIBLE;
    }
}
