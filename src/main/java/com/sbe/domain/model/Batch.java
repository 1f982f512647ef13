package com.sbe.domain.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Output of solving or falling back on a chunk.
 * Immutable; netting produces a new instance via {@link #withNetting(NettingResult)}.
 */
@Value
@Builder(toBuilder = true)
public class Batch {
    String batchId;
    String chunkId;
    SettlementWindow window;
    CurrencyPair pair;
    List<String> memberIds;
    Map<String, BigDecimal> grossSubtotals;
    CostBreakdown cost;
    BatchStatus status;
    /** Populated for INFEASIBLE batches only. */
    Map<String, DeferralReason> deferralReasons;
    NettingResult netting;

    public int size() {
        return memberIds.size();
    }

    public boolean isNetted() {
        return netting != null;
    }

    public Batch withNetting(NettingResult result) {
        if (netting != null) {
            throw new IllegalStateException("Batch " + batchId + " is already netted");
        }
        if (!status.isNettable()) {
            throw new IllegalStateException("Batch " + batchId + " is " + status + " and cannot be netted");
        }
        return toBuilder().netting(result).build();
    }
}
