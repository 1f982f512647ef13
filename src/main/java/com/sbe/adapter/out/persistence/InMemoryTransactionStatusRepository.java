package com.sbe.adapter.out.persistence;

import com.sbe.application.port.out.TransactionStatusRepository;
import com.sbe.domain.model.TransactionState;
import io.vertx.core.Future;

import java.util.Collection;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory latest-status view, keyed by transaction id
 */
public class InMemoryTransactionStatusRepository implements TransactionStatusRepository {

    private final ConcurrentMap<String, TransactionState> states = new ConcurrentHashMap<>();

    @Override
    public Future<Void> save(TransactionState state) {
        states.put(state.getTransactionId(), state);
        return Future.succeededFuture();
    }

    @Override
    public Future<Void> saveAll(Collection<TransactionState> batch) {
        batch.forEach(state -> states.put(state.getTransactionId(), state));
        return Future.succeededFuture();
    }

    @Override
    public Future<Optional<TransactionState>> findById(String transactionId) {
        return Future.succeededFuture(Optional.ofNullable(states.get(transactionId)));
    }
}
