package com.sbe.application.service.batching;

import com.sbe.domain.model.Batch;
import com.sbe.domain.model.TransactionIntent;

import java.util.List;

/**
 * Batches produced for a chunk, and the members to requeue for the next cycle
 */
public record ChunkOutcome(String chunkId, List<Batch> batches, List<TransactionIntent> deferred) {

    public ChunkOutcome {
        batches = List.copyOf(batches);
        deferred = List.copyOf(deferred);
    }
}
