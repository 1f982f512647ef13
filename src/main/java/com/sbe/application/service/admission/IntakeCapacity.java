package com.sbe.application.service.admission;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded count of admitted transactions that have not yet reached a terminal batch.
 * Acquired by the gate, released by the batching side.
 */
@Slf4j
public class IntakeCapacity {

    private final int limit;
    private final AtomicInteger inFlight = new AtomicInteger();

    public IntakeCapacity(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("Intake limit must be positive: " + limit);
        }
        this.limit = limit;
    }

    public boolean tryAcquire() {
        while (true) {
            int current = inFlight.get();
            if (current >= limit) {
                return false;
            }
            if (inFlight.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    public void release(int count) {
        int remaining = inFlight.addAndGet(-count);
        if (remaining < 0) {
            log.error("Intake capacity released below zero ({}), resetting", remaining);
            inFlight.compareAndSet(remaining, 0);
        }
    }

    public int inFlight() {
        return inFlight.get();
    }

    public int limit() {
        return limit;
    }
}
