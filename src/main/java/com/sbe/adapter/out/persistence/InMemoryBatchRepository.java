package com.sbe.adapter.out.persistence;

import com.sbe.application.port.out.BatchRepository;
import com.sbe.domain.model.Batch;
import io.vertx.core.Future;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory batch state for status queries
 */
public class InMemoryBatchRepository implements BatchRepository {

    private final ConcurrentMap<String, Batch> batches = new ConcurrentHashMap<>();

    @Override
    public Future<Void> save(Batch batch) {
        batches.put(batch.getBatchId(), batch);
        return Future.succeededFuture();
    }

    @Override
    public Future<Optional<Batch>> findById(String batchId) {
        return Future.succeededFuture(Optional.ofNullable(batches.get(batchId)));
    }
}
