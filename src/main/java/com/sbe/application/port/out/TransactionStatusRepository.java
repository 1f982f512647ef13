package com.sbe.application.port.out;

import com.sbe.domain.model.TransactionState;
import io.vertx.core.Future;

import java.util.Collection;
import java.util.Optional;

/**
 * Output port for per-transaction status
 */
public interface TransactionStatusRepository {

    Future<Void> save(TransactionState state);

    Future<Void> saveAll(Collection<TransactionState> states);

    Future<Optional<TransactionState>> findById(String transactionId);
}
