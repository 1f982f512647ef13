package com.sbe.application.service.batching;

import com.sbe.domain.model.QueueKey;
import com.sbe.domain.model.TransactionIntent;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Routes accepted intents to the queue of their (settlement window, ordered currency pair).
 * An intent whose transaction id is still owned by any queue is refused.
 * Single owner; not thread-safe.
 */
public class WindowPairGrouper {

    private final Map<QueueKey, SettlementQueue> queues = new LinkedHashMap<>();

    /**
     * @return the queue holding the intent, or empty when its transaction id is already in progress
     */
    public Optional<SettlementQueue> route(TransactionIntent intent, Instant now) {
        boolean inProgress = queues.values().stream().anyMatch(queue -> queue.owns(intent.getTransactionId()));
        if (inProgress) {
            return Optional.empty();
        }
        SettlementQueue queue = queues.computeIfAbsent(QueueKey.of(intent), SettlementQueue::new);
        return queue.enqueue(intent, now) ? Optional.of(queue) : Optional.empty();
    }

    public Optional<SettlementQueue> queue(QueueKey key) {
        return Optional.ofNullable(queues.get(key));
    }

    public Collection<SettlementQueue> queues() {
        return Collections.unmodifiableCollection(queues.values());
    }

    public int totalQueued() {
        return queues.values().stream().mapToInt(SettlementQueue::size).sum();
    }
}
