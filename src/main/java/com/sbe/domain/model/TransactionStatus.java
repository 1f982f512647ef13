package com.sbe.domain.model;

/**
 * Lifecycle status of an admitted transaction as seen by status queries
 */
public enum TransactionStatus {
    SUBMITTED("submitted"),
    DEFERRED("deferred"),
    NETTED("netted"),
    COMMITTED("committed"),
    ABORTED("aborted"),
    INFEASIBLE("infeasible");

    private final String value;

    TransactionStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
