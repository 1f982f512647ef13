package com.sbe.application.service.solver;

import com.sbe.application.port.out.SettlementLimitProvider;
import com.sbe.domain.model.Batch;
import com.sbe.domain.model.BatchStatus;
import com.sbe.domain.model.Chunk;
import com.sbe.domain.model.CurrencyPair;
import com.sbe.domain.model.TransactionIntent;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deterministic greedy assignment used when the solver fails or runs out of time.
 *
 * Members are grouped by counterparty, then by currency pair, each in order of first
 * arrival, and laid into batches next-fit: a new batch starts when the current one is
 * full or the counterparty's exposure in it would pass its cap.
 */
@Slf4j
public class FallbackAssigner {

    private final ConstraintScreen screen;
    private final SettlementLimitProvider limits;
    private final BatchAssembler assembler;
    private final int maxBatchSize;

    public FallbackAssigner(ConstraintScreen screen, SettlementLimitProvider limits, BatchAssembler assembler,
                            int maxBatchSize) {
        if (maxBatchSize <= 0) {
            throw new IllegalArgumentException("maxBatchSize must be positive: " + maxBatchSize);
        }
        this.screen = screen;
        this.limits = limits;
        this.assembler = assembler;
        this.maxBatchSize = maxBatchSize;
    }

    public List<Batch> assign(Chunk chunk) {
        ConstraintScreen.Screening screening = screen.screen(chunk);
        List<List<TransactionIntent>> packed = pack(screening.getAdmitted());
        log.info("Fallback assignment for chunk {}: {} batches, {} deferred",
                chunk.getChunkId(), packed.size(), screening.getDeferred().size());
        return assembler.assembleAll(chunk, packed, BatchStatus.FALLBACK, screening);
    }

    List<List<TransactionIntent>> pack(List<TransactionIntent> admitted) {
        Map<String, Map<CurrencyPair, List<TransactionIntent>>> grouped = new LinkedHashMap<>();
        for (TransactionIntent intent : admitted) {
            grouped.computeIfAbsent(intent.getCounterpartyId(), k -> new LinkedHashMap<>())
                    .computeIfAbsent(intent.getCurrencyPair(), k -> new ArrayList<>())
                    .add(intent);
        }

        List<List<TransactionIntent>> batches = new ArrayList<>();
        List<TransactionIntent> current = new ArrayList<>();
        Map<String, BigDecimal> exposure = new HashMap<>();

        for (Map.Entry<String, Map<CurrencyPair, List<TransactionIntent>>> byCounterparty : grouped.entrySet()) {
            String counterpartyId = byCounterparty.getKey();
            BigDecimal cap = limits.exposureCap(counterpartyId);
            for (List<TransactionIntent> group : byCounterparty.getValue().values()) {
                for (TransactionIntent intent : group) {
                    BigDecimal used = exposure.getOrDefault(counterpartyId, BigDecimal.ZERO);
                    if (current.size() >= maxBatchSize || used.add(intent.getAmount()).compareTo(cap) > 0) {
                        batches.add(current);
                        current = new ArrayList<>();
                        exposure.clear();
                        used = BigDecimal.ZERO;
                    }
                    current.add(intent);
                    exposure.put(counterpartyId, used.add(intent.getAmount()));
                }
            }
        }
        if (!current.isEmpty()) {
            batches.add(current);
        }
        return batches;
    }
}
