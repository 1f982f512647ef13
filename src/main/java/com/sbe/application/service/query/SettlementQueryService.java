package com.sbe.application.service.query;

import com.sbe.application.port.in.SettlementQueryUseCase;
import com.sbe.application.port.out.BatchRepository;
import com.sbe.application.port.out.LedgerLog;
import com.sbe.application.port.out.LedgerLog.LedgerEntry;
import com.sbe.application.port.out.TransactionStatusRepository;
import com.sbe.domain.model.Batch;
import com.sbe.domain.model.TransactionState;
import io.vertx.core.Future;
import lombok.RequiredArgsConstructor;

import java.util.List;
import java.util.Optional;

/**
 * Read side over the batch and status repositories and the event log
 */
@RequiredArgsConstructor
public class SettlementQueryService implements SettlementQueryUseCase {

    private final BatchRepository batchRepository;
    private final TransactionStatusRepository statusRepository;
    private final LedgerLog ledgerLog;

    @Override
    public Future<Optional<Batch>> findBatch(String batchId) {
        return batchRepository.findById(batchId);
    }

    @Override
    public Future<Optional<TransactionState>> findTransaction(String transactionId) {
        return statusRepository.findById(transactionId);
    }

    @Override
    public Future<List<LedgerEntry>> replayLedger(long fromOffset) {
        if (fromOffset < 0) {
            return Future.failedFuture(new IllegalArgumentException("fromOffset must not be negative: " + fromOffset));
        }
        return ledgerLog.replay(fromOffset);
    }
}
