package com.sbe.adapter.out.persistence;

import com.sbe.application.port.out.SettlementStore;
import com.sbe.domain.model.Batch;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Write-once store of confirmed batches
 */
@Slf4j
public class InMemorySettlementStore implements SettlementStore {

    private final ConcurrentMap<String, Batch> confirmed = new ConcurrentHashMap<>();

    @Override
    public Future<Boolean> saveConfirmed(Batch batch) {
        boolean stored = confirmed.putIfAbsent(batch.getBatchId(), batch) == null;
        if (stored) {
            log.info("Stored confirmed batch {} ({} members)", batch.getBatchId(), batch.size());
        }
        return Future.succeededFuture(stored);
    }

    public Optional<Batch> find(String batchId) {
        return Optional.ofNullable(confirmed.get(batchId));
    }
}
