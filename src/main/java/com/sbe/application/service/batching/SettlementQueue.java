package com.sbe.application.service.batching;

import com.sbe.domain.model.QueueKey;
import com.sbe.domain.model.TransactionIntent;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Pending transactions of one (window, currency pair), in arrival order.
 *
 * Not thread-safe: a queue has a single owner, and at most one chunk taken from it
 * is being solved at any time (see {@link #markBusy()}).
 * A transaction id is owned by the queue from enqueue until it is forgotten or exhausted,
 * whether pending, in a chunk or deferred; it is never queued twice.
 */
@Slf4j
public class SettlementQueue {

    @Getter
    private final QueueKey key;
    private final Deque<QueuedIntent> pending = new ArrayDeque<>();
    private final Map<String, Integer> deferrals = new HashMap<>();
    private final Set<String> owned = new HashSet<>();
    private boolean busy;
    private long chunkSequence;

    public SettlementQueue(QueueKey key) {
        this.key = key;
    }

    /**
     * @return false when the transaction id is already owned by this queue; the intent is not queued
     */
    public boolean enqueue(TransactionIntent intent, Instant now) {
        if (!key.equals(QueueKey.of(intent))) {
            throw new IllegalArgumentException("Transaction " + intent.getTransactionId() + " does not belong to " + key);
        }
        if (!owned.add(intent.getTransactionId())) {
            log.warn("Transaction {} is already queued on {}, refusing the second copy", intent.getTransactionId(), key);
            return false;
        }
        pending.addLast(new QueuedIntent(intent, now));
        return true;
    }

    public boolean owns(String transactionId) {
        return owned.contains(transactionId);
    }

    /**
     * Put deferred transactions back at the head of the queue, keeping their relative order.
     * Their batching timeout restarts from {@code now}.
     *
     * @return transactions that used up their deferral attempts and were not requeued
     */
    public List<TransactionIntent> requeueDeferred(List<TransactionIntent> deferred, Instant now, int maxAttempts) {
        List<TransactionIntent> exhausted = new ArrayList<>();
        List<QueuedIntent> requeued = new ArrayList<>();
        for (TransactionIntent intent : deferred) {
            int attempts = deferrals.merge(intent.getTransactionId(), 1, Integer::sum);
            if (attempts > maxAttempts) {
                deferrals.remove(intent.getTransactionId());
                owned.remove(intent.getTransactionId());
                exhausted.add(intent);
            } else {
                requeued.add(new QueuedIntent(intent, now));
            }
        }
        for (int i = requeued.size() - 1; i >= 0; i--) {
            pending.addFirst(requeued.get(i));
        }
        return exhausted;
    }

    /**
     * Release transactions that reached a terminal batch
     */
    public void forget(Collection<String> transactionIds) {
        transactionIds.forEach(id -> {
            deferrals.remove(id);
            owned.remove(id);
        });
    }

    public int deferralAttempts(String transactionId) {
        return deferrals.getOrDefault(transactionId, 0);
    }

    public Optional<Instant> oldestEnqueuedAt() {
        return pending.stream().map(QueuedIntent::enqueuedAt).min(Instant::compareTo);
    }

    List<TransactionIntent> take(int count) {
        List<TransactionIntent> taken = new ArrayList<>(count);
        for (int i = 0; i < count && !pending.isEmpty(); i++) {
            taken.add(pending.pollFirst().intent());
        }
        return taken;
    }

    String nextChunkId() {
        chunkSequence++;
        return String.format("%s-%s-%s-%06d", key.getWindow().getValue(),
                key.getPair().getSource(), key.getPair().getDestination(), chunkSequence);
    }

    public int size() {
        return pending.size();
    }

    public boolean isEmpty() {
        return pending.isEmpty();
    }

    public boolean isBusy() {
        return busy;
    }

    public void markBusy() {
        if (busy) {
            throw new IllegalStateException("Queue " + key + " already has a chunk in progress");
        }
        busy = true;
    }

    public void markIdle() {
        busy = false;
    }

    private record QueuedIntent(TransactionIntent intent, Instant enqueuedAt) {}
}
