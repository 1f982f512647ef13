package com.sbe.application.service.admission;

import com.sbe.adapter.out.persistence.InMemoryDedupStore;
import com.sbe.adapter.out.persistence.InMemoryLedgerLog;
import com.sbe.application.service.ledger.LedgerEmitter;
import com.sbe.domain.event.LedgerEventType;
import com.sbe.domain.model.DedupRecord;
import com.sbe.support.Intents;
import com.sbe.support.MutableClock;
import io.vertx.core.Vertx;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit test for DedupRetentionService
 */
class DedupRetentionServiceTest {

    private Vertx vertx;
    private MutableClock clock;
    private InMemoryDedupStore<String> store;
    private LedgerEmitter ledgerEmitter;
    private DedupRetentionService service;

    @BeforeEach
    void setUp() {
        vertx = Vertx.vertx();
        clock = new MutableClock(Intents.T0);
        store = new InMemoryDedupStore<>();
        ledgerEmitter = new LedgerEmitter(vertx, new InMemoryLedgerLog(), clock, 3, Duration.ofMillis(1));
        service = new DedupRetentionService(vertx, store, ledgerEmitter, clock, Duration.ofMillis(20));
    }

    @AfterEach
    void tearDown() throws Exception {
        service.stopPeriodicPurge();
        CountDownLatch latch = new CountDownLatch(1);
        vertx.close().onComplete(ar -> latch.countDown());
        latch.await(5, TimeUnit.SECONDS);
    }

    @Test
    void purgeExpired_shouldRemoveOnlyExpiredRecords() {
        // Given
        store.putIfAbsent(record("K1", Duration.ofHours(1)), clock.instant());
        store.putIfAbsent(record("K2", Duration.ofHours(48)), clock.instant());
        clock.advance(Duration.ofHours(24));

        // When
        int removed = service.purgeExpired();

        // Then
        assertEquals(1, removed);
        assertTrue(store.find("K1", clock.instant()).isEmpty());
        assertTrue(store.find("K2", clock.instant()).isPresent());
    }

    @Test
    void purgeExpired_shouldDropSequenceCountersOfReleasedTransactions() {
        // Given
        for (int i = 0; i < 50; i++) {
            String key = "K" + i;
            store.putIfAbsent(record(key, Duration.ofHours(1)), clock.instant(),
                    () -> ledgerEmitter.emit(LedgerEventType.SUBMITTED, "T-" + key, Map.of()));
        }
        store.putIfAbsent(record("live", Duration.ofHours(48)), clock.instant(),
                () -> ledgerEmitter.emit(LedgerEventType.SUBMITTED, "T-live", Map.of()));
        assertEquals(51, ledgerEmitter.trackedEntities());
        clock.advance(Duration.ofHours(24));

        // When
        int removed = service.purgeExpired();

        // Then
        assertEquals(50, removed);
        assertEquals(1, ledgerEmitter.trackedEntities());
        assertEquals(0, ledgerEmitter.lastSequence("T-K0"));
        assertEquals(1, ledgerEmitter.lastSequence("T-live"));
    }

    @Test
    void startPeriodicPurge_shouldPurgeOnTimer() throws InterruptedException {
        // Given
        store.putIfAbsent(record("K1", Duration.ofMinutes(1)), clock.instant());
        clock.advance(Duration.ofMinutes(5));

        // When
        service.startPeriodicPurge();

        // Then
        long deadline = System.currentTimeMillis() + 5000;
        while (store.size() > 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(0, store.size());
    }

    @Test
    void stopPeriodicPurge_canBeCalledTwice() {
        service.startPeriodicPurge();
        service.stopPeriodicPurge();
        service.stopPeriodicPurge();
    }

    private DedupRecord<String> record(String key, Duration ttl) {
        return new DedupRecord<>(key, "T-" + key, "outcome-" + key, clock.instant(), clock.instant().plus(ttl));
    }
}
