package com.sbe.application.service.admission;

import com.sbe.application.port.out.DedupStore;
import com.sbe.application.service.ledger.LedgerEmitter;
import io.vertx.core.Vertx;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;

/**
 * Periodically drops idempotency records past their retention horizon.
 * A released transaction id also drops its event sequence counter.
 */
@Slf4j
public class DedupRetentionService {

    private final Vertx vertx;
    private final DedupStore<?> dedupStore;
    private final LedgerEmitter ledgerEmitter;
    private final Clock clock;
    private final Duration interval;
    private Long timerId;

    public DedupRetentionService(Vertx vertx, DedupStore<?> dedupStore, LedgerEmitter ledgerEmitter,
                                 Clock clock, Duration interval) {
        this.vertx = vertx;
        this.dedupStore = dedupStore;
        this.ledgerEmitter = ledgerEmitter;
        this.clock = clock;
        this.interval = interval;
    }

    public void startPeriodicPurge() {
        if (timerId != null) {
            return;
        }
        log.info("Starting dedup retention service (interval: {} ms)", interval.toMillis());
        timerId = vertx.setPeriodic(interval.toMillis(), id -> purgeExpired());
    }

    public void stopPeriodicPurge() {
        if (timerId != null) {
            vertx.cancelTimer(timerId);
            timerId = null;
            log.info("Dedup retention service stopped");
        }
    }

    public int purgeExpired() {
        int removed = dedupStore.purgeExpired(clock.instant(),
                record -> ledgerEmitter.forget(record.getTransactionId())).size();
        if (removed > 0) {
            log.info("Purged {} expired idempotency records", removed);
        }
        return removed;
    }
}
