package com.sbe.adapter.out.persistence;

import com.sbe.application.port.out.DedupStore;
import com.sbe.domain.model.DedupRecord;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Consumer;

/**
 * In-memory idempotency store.
 * Reservations of a key and its transaction id happen under one lock; lookups by key read without it.
 */
public class InMemoryDedupStore<T> implements DedupStore<T> {

    private final ConcurrentMap<String, DedupRecord<T>> byKey = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, DedupRecord<T>> byTransactionId = new ConcurrentHashMap<>();

    @Override
    public synchronized Optional<DedupRecord<T>> putIfAbsent(DedupRecord<T> candidate, Instant now, Runnable onReserved) {
        DedupRecord<T> holder = live(byKey.get(candidate.getIdempotencyKey()), now);
        if (holder == null) {
            holder = live(byTransactionId.get(candidate.getTransactionId()), now);
        }
        if (holder != null) {
            return Optional.of(holder);
        }

        onReserved.run();
        byTransactionId.put(candidate.getTransactionId(), candidate);
        byKey.put(candidate.getIdempotencyKey(), candidate);
        return Optional.empty();
    }

    @Override
    public Optional<DedupRecord<T>> find(String idempotencyKey, Instant now) {
        return Optional.ofNullable(live(byKey.get(idempotencyKey), now));
    }

    @Override
    public synchronized List<DedupRecord<T>> purgeExpired(Instant now, Consumer<DedupRecord<T>> onReleased) {
        byKey.values().removeIf(record -> record.isExpired(now));

        List<DedupRecord<T>> released = new ArrayList<>();
        Iterator<Map.Entry<String, DedupRecord<T>>> it = byTransactionId.entrySet().iterator();
        while (it.hasNext()) {
            DedupRecord<T> record = it.next().getValue();
            if (record.isExpired(now)) {
                released.add(record);
                it.remove();
                onReleased.accept(record);
            }
        }
        return released;
    }

    public int size() {
        return byKey.size();
    }

    private DedupRecord<T> live(DedupRecord<T> record, Instant now) {
        return record == null || record.isExpired(now) ? null : record;
    }
}
