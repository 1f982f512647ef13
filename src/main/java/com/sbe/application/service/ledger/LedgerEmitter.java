package com.sbe.application.service.ledger;

import com.sbe.application.port.out.LedgerLog;
import com.sbe.domain.event.LedgerEvent;
import com.sbe.domain.event.LedgerEventType;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Boundary through which the core hands ordered domain events to the external log.
 *
 * Each event gets the next sequence number of its entity. Appends are chained so the log
 * sees events in emission order; a failed append is retried with exponential backoff
 * before the chain moves on. Callers never wait on the log.
 */
@Slf4j
public class LedgerEmitter {

    private final Vertx vertx;
    private final LedgerLog ledgerLog;
    private final Clock clock;
    private final int maxAttempts;
    private final Duration initialBackoff;

    private final ConcurrentMap<String, AtomicLong> sequences = new ConcurrentHashMap<>();
    private Future<Void> tail = Future.succeededFuture();

    public LedgerEmitter(Vertx vertx, LedgerLog ledgerLog, Clock clock, int maxAttempts, Duration initialBackoff) {
        this.vertx = vertx;
        this.ledgerLog = ledgerLog;
        this.clock = clock;
        this.maxAttempts = maxAttempts;
        this.initialBackoff = initialBackoff;
    }

    /**
     * Emit the next event for an entity
     * @return future completed once the log accepted the event
     */
    public synchronized Future<LedgerEvent> emit(LedgerEventType type, String entityId, Map<String, Object> attributes) {
        long sequence = sequences.computeIfAbsent(entityId, id -> new AtomicLong()).incrementAndGet();
        LedgerEvent event = new LedgerEvent(
                LedgerEvent.eventId(entityId, sequence),
                type,
                entityId,
                sequence,
                clock.instant(),
                Map.copyOf(attributes)
        );
        log.debug("Emitting {} for {} (seq {})", type, entityId, sequence);

        Future<LedgerEvent> appended = tail.transform(ignored -> appendWithRetry(event, 1)).map(offset -> event);
        tail = appended.<Void>mapEmpty().otherwiseEmpty();
        return appended;
    }

    /**
     * Emit the last event an entity will ever get and drop its sequence counter
     */
    public synchronized Future<LedgerEvent> emitFinal(LedgerEventType type, String entityId, Map<String, Object> attributes) {
        Future<LedgerEvent> appended = emit(type, entityId, attributes);
        sequences.remove(entityId);
        return appended;
    }

    /**
     * Drop the sequence counter of an entity that will not emit again
     */
    public synchronized void forget(String entityId) {
        sequences.remove(entityId);
    }

    /**
     * @return number of entities holding a live sequence counter
     */
    public int trackedEntities() {
        return sequences.size();
    }

    /**
     * @return last sequence number issued for the entity, 0 when none
     */
    public long lastSequence(String entityId) {
        AtomicLong sequence = sequences.get(entityId);
        return sequence == null ? 0 : sequence.get();
    }

    private Future<Long> appendWithRetry(LedgerEvent event, int attempt) {
        return ledgerLog.append(event).recover(error -> {
            if (attempt >= maxAttempts) {
                log.error("Giving up on event {} after {} attempts", event.getEventId(), attempt, error);
                return Future.failedFuture(new DownstreamUnavailableException(
                        "Event log unavailable for " + event.getEventId(), error));
            }
            long delay = initialBackoff.toMillis() << (attempt - 1);
            log.warn("Append of {} failed (attempt {}/{}), retrying in {} ms: {}",
                    event.getEventId(), attempt, maxAttempts, delay, error.getMessage());

            Promise<Long> retried = Promise.promise();
            vertx.setTimer(Math.max(1, delay), id -> appendWithRetry(event, attempt + 1).onComplete(retried));
            return retried.future();
        });
    }
}
