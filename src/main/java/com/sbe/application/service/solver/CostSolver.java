package com.sbe.application.service.solver;

import com.sbe.application.port.out.SettlementLimitProvider;
import com.sbe.domain.model.Batch;
import com.sbe.domain.model.BatchStatus;
import com.sbe.domain.model.Chunk;
import com.sbe.domain.model.TransactionIntent;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BooleanSupplier;

/**
 * Cost-minimizing partition of a chunk.
 *
 * The search starts from the fallback assignment and improves each wire group separately,
 * so its result never costs more than the fallback for the same chunk. Groups are then
 * laid into batches first-fit in order of first arrival.
 */
@Slf4j
public class CostSolver implements BatchSolver {

    private final ConstraintScreen screen;
    private final FallbackAssigner fallback;
    private final BatchAssembler assembler;
    private final GroupPacker packer;
    private final SettlementLimitProvider limits;
    private final int maxBatchSize;
    private final long maxSearchNodes;

    public CostSolver(ConstraintScreen screen, FallbackAssigner fallback, BatchAssembler assembler, CostModel costModel,
                      SettlementLimitProvider limits, int maxBatchSize, long maxSearchNodes, int maxExactGroupSize) {
        this.screen = screen;
        this.fallback = fallback;
        this.assembler = assembler;
        this.packer = new GroupPacker(costModel, maxBatchSize, maxExactGroupSize);
        this.limits = limits;
        this.maxBatchSize = maxBatchSize;
        this.maxSearchNodes = maxSearchNodes;
    }

    @Override
    public List<Batch> solve(Chunk chunk, BooleanSupplier cancelled) throws SolverFailureException {
        SearchBudget budget = new SearchBudget(chunk.getChunkId(), maxSearchNodes, cancelled);
        ConstraintScreen.Screening screening = screen.screen(chunk);
        List<TransactionIntent> admitted = screening.getAdmitted();

        Map<String, Integer> arrival = new HashMap<>();
        for (int i = 0; i < chunk.getMembers().size(); i++) {
            arrival.put(chunk.getMembers().get(i).getTransactionId(), i);
        }

        Map<CostModel.WireKey, List<List<TransactionIntent>>> incumbent = segmentsByKey(fallback.pack(admitted));

        List<List<TransactionIntent>> groups = new ArrayList<>();
        for (Map.Entry<CostModel.WireKey, List<TransactionIntent>> entry : CostModel.byWireKey(admitted).entrySet()) {
            budget.checkCancelled();
            CostModel.WireKey key = entry.getKey();
            groups.addAll(packer.bestGrouping(entry.getValue(), incumbent.get(key),
                    limits.exposureCap(key.getCounterpartyId()), arrival, budget));
        }
        budget.checkCancelled();

        List<List<TransactionIntent>> batches = place(groups, arrival);
        log.debug("Solved chunk {}: {} batches, {} deferred, {} search nodes",
                chunk.getChunkId(), batches.size(), screening.getDeferred().size(), budget.visited());
        return assembler.assembleAll(chunk, batches, BatchStatus.OPTIMAL, screening);
    }

    /**
     * Per wire key, the member runs the fallback put into each of its batches
     */
    private static Map<CostModel.WireKey, List<List<TransactionIntent>>> segmentsByKey(List<List<TransactionIntent>> batches) {
        Map<CostModel.WireKey, List<List<TransactionIntent>>> segments = new LinkedHashMap<>();
        for (List<TransactionIntent> batch : batches) {
            for (Map.Entry<CostModel.WireKey, List<TransactionIntent>> entry : CostModel.byWireKey(batch).entrySet()) {
                segments.computeIfAbsent(entry.getKey(), k -> new ArrayList<>()).add(entry.getValue());
            }
        }
        return segments;
    }

    private List<List<TransactionIntent>> place(List<List<TransactionIntent>> groups, Map<String, Integer> arrival) {
        List<List<TransactionIntent>> ordered = new ArrayList<>(groups);
        ordered.sort(Comparator.comparing(group -> arrival.get(group.get(0).getTransactionId())));

        List<List<TransactionIntent>> batches = new ArrayList<>();
        List<Set<CostModel.WireKey>> keys = new ArrayList<>();
        List<Map<String, BigDecimal>> exposures = new ArrayList<>();

        for (List<TransactionIntent> group : ordered) {
            CostModel.WireKey key = CostModel.WireKey.of(group.get(0));
            String counterpartyId = key.getCounterpartyId();
            BigDecimal groupAmount = group.stream().map(TransactionIntent::getAmount).reduce(BigDecimal.ZERO, BigDecimal::add);
            BigDecimal cap = limits.exposureCap(counterpartyId);

            int target = -1;
            for (int i = 0; i < batches.size(); i++) {
                BigDecimal exposure = exposures.get(i).getOrDefault(counterpartyId, BigDecimal.ZERO).add(groupAmount);
                if (batches.get(i).size() + group.size() <= maxBatchSize
                        && !keys.get(i).contains(key)
                        && exposure.compareTo(cap) <= 0) {
                    target = i;
                    break;
                }
            }
            if (target < 0) {
                batches.add(new ArrayList<>());
                keys.add(new HashSet<>());
                exposures.add(new HashMap<>());
                target = batches.size() - 1;
            }
            batches.get(target).addAll(group);
            keys.get(target).add(key);
            exposures.get(target).merge(counterpartyId, groupAmount, BigDecimal::add);
        }

        Comparator<TransactionIntent> byArrival = Comparator.comparing(intent -> arrival.get(intent.getTransactionId()));
        batches.forEach(batch -> batch.sort(byArrival));
        return batches;
    }
}
