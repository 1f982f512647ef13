package com.sbe.application.service.batching;

import com.sbe.domain.model.Chunk;
import com.sbe.domain.model.TransactionIntent;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Cuts a chunk from a queue once it is full or its oldest member waited out the batching timeout.
 * Members are taken from the head, so arrival order is preserved.
 */
@Slf4j
public class Chunker {

    private final int maxChunkSize;
    private final Duration batchTimeout;

    public Chunker(int maxChunkSize, Duration batchTimeout) {
        if (maxChunkSize <= 0) {
            throw new IllegalArgumentException("maxChunkSize must be positive: " + maxChunkSize);
        }
        this.maxChunkSize = maxChunkSize;
        this.batchTimeout = batchTimeout;
    }

    public Optional<Chunk> cut(SettlementQueue queue, Instant now) {
        if (queue.isEmpty()) {
            return Optional.empty();
        }

        boolean full = queue.size() >= maxChunkSize;
        boolean expired = queue.oldestEnqueuedAt()
                .map(oldest -> !oldest.plus(batchTimeout).isAfter(now))
                .orElse(false);
        if (!full && !expired) {
            return Optional.empty();
        }

        List<TransactionIntent> members = queue.take(Math.min(maxChunkSize, queue.size()));
        Chunk chunk = new Chunk(queue.nextChunkId(), queue.getKey(), members, now);
        log.debug("Formed chunk {} with {} members ({})", chunk.getChunkId(), chunk.size(), full ? "size" : "timeout");
        return Optional.of(chunk);
    }
}
