package com.sbe.application.service.batching;

import com.sbe.application.port.out.AgreementService;
import com.sbe.application.port.out.AgreementService.AgreementOutcome;
import com.sbe.application.port.out.BatchRepository;
import com.sbe.application.port.out.SettlementStore;
import com.sbe.application.port.out.TransactionStatusRepository;
import com.sbe.application.service.admission.IntakeCapacity;
import com.sbe.application.service.ledger.LedgerEmitter;
import com.sbe.application.service.netting.NettingCalculator;
import com.sbe.application.service.solver.FallbackAssigner;
import com.sbe.application.service.solver.SolverInvoker;
import com.sbe.domain.event.LedgerEventType;
import com.sbe.domain.model.Batch;
import com.sbe.domain.model.BatchStatus;
import com.sbe.domain.model.Chunk;
import com.sbe.domain.model.TransactionIntent;
import com.sbe.domain.model.TransactionState;
import com.sbe.domain.model.TransactionStatus;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Takes one chunk from solve to hand-off: solve (or fall back), net, record, emit events,
 * then propose every netted batch to the agreement stage.
 */
@Slf4j
public class SettlementPipeline {

    private final SolverInvoker solver;
    private final FallbackAssigner fallback;
    private final NettingCalculator nettingCalculator;
    private final LedgerEmitter ledgerEmitter;
    private final BatchRepository batchRepository;
    private final TransactionStatusRepository statusRepository;
    private final AgreementService agreementService;
    private final SettlementStore settlementStore;
    private final IntakeCapacity capacity;
    private final int maxBatchSize;
    private final Clock clock;

    public SettlementPipeline(
            SolverInvoker solver,
            FallbackAssigner fallback,
            NettingCalculator nettingCalculator,
            LedgerEmitter ledgerEmitter,
            BatchRepository batchRepository,
            TransactionStatusRepository statusRepository,
            AgreementService agreementService,
            SettlementStore settlementStore,
            IntakeCapacity capacity,
            int maxBatchSize,
            Clock clock
    ) {
        this.solver = solver;
        this.fallback = fallback;
        this.nettingCalculator = nettingCalculator;
        this.ledgerEmitter = ledgerEmitter;
        this.batchRepository = batchRepository;
        this.statusRepository = statusRepository;
        this.agreementService = agreementService;
        this.settlementStore = settlementStore;
        this.capacity = capacity;
        this.maxBatchSize = maxBatchSize;
        this.clock = clock;
    }

    public Future<ChunkOutcome> process(Chunk chunk) {
        log.info("Processing chunk {} ({} members, {})", chunk.getChunkId(), chunk.size(), chunk.getQueueKey());
        return solver.solve(chunk)
                .map(batches -> verified(chunk, batches))
                .recover(error -> {
                    log.warn("Falling back for chunk {}: {}", chunk.getChunkId(), error.getMessage());
                    return Future.succeededFuture(fallback.assign(chunk));
                })
                .map(batches -> verified(chunk, batches))
                .map(batches -> settle(chunk, batches));
    }

    /**
     * Every member in exactly one batch, no batch over the size bound
     */
    private List<Batch> verified(Chunk chunk, List<Batch> batches) {
        Set<String> expected = new HashSet<>(chunk.memberIds());
        Set<String> seen = new HashSet<>();
        for (Batch batch : batches) {
            if (batch.getStatus() != BatchStatus.INFEASIBLE && batch.size() > maxBatchSize) {
                throw new IllegalStateException("Batch " + batch.getBatchId() + " has " + batch.size()
                        + " members, limit is " + maxBatchSize);
            }
            for (String memberId : batch.getMemberIds()) {
                if (!seen.add(memberId)) {
                    throw new IllegalStateException("Transaction " + memberId + " assigned twice in chunk " + chunk.getChunkId());
                }
            }
        }
        if (!seen.equals(expected)) {
            throw new IllegalStateException("Batches of chunk " + chunk.getChunkId() + " do not cover its members");
        }
        return batches;
    }

    private ChunkOutcome settle(Chunk chunk, List<Batch> batches) {
        Map<String, TransactionIntent> intents = chunk.membersById();
        List<Batch> recorded = new ArrayList<>(batches.size());
        List<TransactionIntent> deferred = new ArrayList<>();

        for (Batch batch : batches) {
            if (batch.getStatus() == BatchStatus.INFEASIBLE) {
                recorded.add(recordInfeasible(batch));
                batch.getMemberIds().forEach(id -> deferred.add(intents.get(id)));
            } else {
                Batch netted = batch.withNetting(nettingCalculator.net(batch, intents));
                recorded.add(recordNetted(netted));
                capacity.release(netted.size());
                handOff(netted);
            }
        }

        log.info("Chunk {} settled into {} batches, {} members deferred",
                chunk.getChunkId(), recorded.size(), deferred.size());
        return new ChunkOutcome(chunk.getChunkId(), recorded, deferred);
    }

    private Batch recordInfeasible(Batch batch) {
        batchRepository.save(batch);
        emitCreated(batch);
        ledgerEmitter.emitFinal(LedgerEventType.BATCH_INFEASIBLE, batch.getBatchId(), Map.of(
                "deferredCount", batch.size(),
                "reasons", batch.getDeferralReasons().entrySet().stream()
                        .collect(Collectors.toMap(Map.Entry::getKey, e -> e.getValue().name()))
        ));
        updateStatuses(batch, TransactionStatus.DEFERRED);
        log.warn("Batch {} deferred {} transactions", batch.getBatchId(), batch.size());
        return batch;
    }

    private Batch recordNetted(Batch batch) {
        batchRepository.save(batch);
        emitCreated(batch);
        LedgerEventType outcome = batch.getStatus() == BatchStatus.OPTIMAL
                ? LedgerEventType.BATCH_OPTIMIZED
                : LedgerEventType.BATCH_FALLBACK;
        ledgerEmitter.emit(outcome, batch.getBatchId(), Map.of(
                "totalCost", batch.getCost().getTotalCost().toPlainString(),
                "wireCount", batch.getCost().getWireCount()
        ));
        ledgerEmitter.emitFinal(LedgerEventType.BATCH_NETTED, batch.getBatchId(), Map.of(
                "grossTransferCount", batch.getNetting().getGrossTransferCount(),
                "netTransferCount", batch.getNetting().getNetTransferCount()
        ));
        updateStatuses(batch, TransactionStatus.NETTED);
        return batch;
    }

    private void emitCreated(Batch batch) {
        ledgerEmitter.emit(LedgerEventType.BATCH_CREATED, batch.getBatchId(), Map.of(
                "chunkId", batch.getChunkId(),
                "window", batch.getWindow().getValue(),
                "pair", batch.getPair().toString(),
                "status", batch.getStatus().name(),
                "memberCount", batch.size()
        ));
    }

    private void handOff(Batch batch) {
        agreementService.propose(batch)
                .compose(outcome -> {
                    if (outcome == AgreementOutcome.COMMITTED) {
                        return settlementStore.saveConfirmed(batch).map(stored -> {
                            if (!stored) {
                                log.warn("Batch {} was already confirmed, keeping the stored copy", batch.getBatchId());
                            }
                            return outcome;
                        });
                    }
                    return Future.succeededFuture(outcome);
                })
                .onSuccess(outcome -> {
                    TransactionStatus status = outcome == AgreementOutcome.COMMITTED
                            ? TransactionStatus.COMMITTED
                            : TransactionStatus.ABORTED;
                    updateStatuses(batch, status);
                    log.info("Batch {} {}", batch.getBatchId(), status.getValue());
                })
                .onFailure(error -> log.error("Agreement hand-off failed for batch {}, it stays netted",
                        batch.getBatchId(), error));
    }

    private void updateStatuses(Batch batch, TransactionStatus status) {
        Instant now = clock.instant();
        statusRepository.saveAll(batch.getMemberIds().stream()
                .map(id -> new TransactionState(id, status, batch.getBatchId(), now))
                .collect(Collectors.toList()));
    }
}
