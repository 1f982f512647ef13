package com.sbe.application.port.in;

import com.sbe.application.port.out.LedgerLog.LedgerEntry;
import com.sbe.domain.model.Batch;
import com.sbe.domain.model.TransactionState;
import io.vertx.core.Future;

import java.util.List;
import java.util.Optional;

/**
 * Inbound port - read side for batches, transactions and the event log
 */
public interface SettlementQueryUseCase {

    /**
     * @param batchId batch identifier
     * @return batch state including netting when present
     */
    Future<Optional<Batch>> findBatch(String batchId);

    /**
     * @param transactionId transaction identifier
     * @return latest status, e.g. DEFERRED for transactions waiting on the next chunk cycle
     */
    Future<Optional<TransactionState>> findTransaction(String transactionId);

    Future<List<LedgerEntry>> replayLedger(long fromOffset);
}
