package com.sbe.domain.event;

/**
 * Domain events handed to the durable log
 */
public enum LedgerEventType {
    SUBMITTED,
    DEDUPED,
    BATCH_CREATED,
    BATCH_OPTIMIZED,
    BATCH_FALLBACK,
    BATCH_INFEASIBLE,
    BATCH_NETTED
}
