package com.sbe.application.service.solver;

import com.sbe.domain.model.Batch;
import com.sbe.domain.model.BatchStatus;
import com.sbe.domain.model.Chunk;
import com.sbe.domain.model.CostBreakdown;
import com.sbe.domain.model.TransactionIntent;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Turns packed member lists into priced {@link Batch} records with ids derived from the chunk id.
 */
public class BatchAssembler {

    private final CostModel costModel;

    public BatchAssembler(CostModel costModel) {
        this.costModel = costModel;
    }

    public List<Batch> assembleAll(Chunk chunk, List<List<TransactionIntent>> packed, BatchStatus status,
                                   ConstraintScreen.Screening screening) {
        List<Batch> batches = new ArrayList<>(packed.size() + 1);
        for (int i = 0; i < packed.size(); i++) {
            batches.add(assemble(chunk, i + 1, packed.get(i), status));
        }
        if (screening.hasDeferred()) {
            batches.add(deferred(chunk, screening));
        }
        return batches;
    }

    public Batch assemble(Chunk chunk, int index, List<TransactionIntent> members, BatchStatus status) {
        return Batch.builder()
                .batchId(String.format("%s-b%02d", chunk.getChunkId(), index))
                .chunkId(chunk.getChunkId())
                .window(chunk.getWindow())
                .pair(chunk.getQueueKey().getPair())
                .memberIds(ids(members))
                .grossSubtotals(grossSubtotals(members))
                .cost(costModel.priceBatch(members))
                .status(status)
                .deferralReasons(Map.of())
                .build();
    }

    public Batch deferred(Chunk chunk, ConstraintScreen.Screening screening) {
        return Batch.builder()
                .batchId(chunk.getChunkId() + "-deferred")
                .chunkId(chunk.getChunkId())
                .window(chunk.getWindow())
                .pair(chunk.getQueueKey().getPair())
                .memberIds(ids(screening.getDeferred()))
                .grossSubtotals(grossSubtotals(screening.getDeferred()))
                .cost(CostBreakdown.ZERO)
                .status(BatchStatus.INFEASIBLE)
                .deferralReasons(screening.getReasons())
                .build();
    }

    private static List<String> ids(List<TransactionIntent> members) {
        return members.stream().map(TransactionIntent::getTransactionId).collect(Collectors.toUnmodifiableList());
    }

    private static Map<String, BigDecimal> grossSubtotals(List<TransactionIntent> members) {
        Map<String, BigDecimal> subtotals = new TreeMap<>();
        for (TransactionIntent intent : members) {
            subtotals.merge(intent.getSourceCurrency(), intent.getAmount(), BigDecimal::add);
        }
        return Collections.unmodifiableMap(subtotals);
    }
}
