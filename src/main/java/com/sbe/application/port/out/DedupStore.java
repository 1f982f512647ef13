package com.sbe.application.port.out;

import com.sbe.domain.model.DedupRecord;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Output port for idempotency records. Shared by all concurrent submitters.
 *
 * @param <T> cached outcome type
 */
public interface DedupStore<T> {

    /**
     * Atomically store the record unless a live record already holds its key or its transaction id.
     * {@code onReserved} runs while the reservation is held, before any other caller can see the record.
     * @return the live record that blocked the candidate, or empty when the candidate was stored
     */
    Optional<DedupRecord<T>> putIfAbsent(DedupRecord<T> candidate, Instant now, Runnable onReserved);

    default Optional<DedupRecord<T>> putIfAbsent(DedupRecord<T> candidate, Instant now) {
        return putIfAbsent(candidate, now, () -> { });
    }

    Optional<DedupRecord<T>> find(String idempotencyKey, Instant now);

    /**
     * Drop expired records. {@code onReleased} runs for each released transaction id before
     * that id can be reserved again.
     * @return records whose transaction id reservation was released
     */
    List<DedupRecord<T>> purgeExpired(Instant now, Consumer<DedupRecord<T>> onReleased);

    default List<DedupRecord<T>> purgeExpired(Instant now) {
        return purgeExpired(now, record -> { });
    }
}
