package com.sbe.application.service.solver;

import com.sbe.application.port.out.SettlementLimitProvider;
import com.sbe.domain.model.Chunk;
import com.sbe.domain.model.DeferralReason;
import com.sbe.domain.model.TransactionIntent;
import lombok.Value;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decides which chunk members can be batched this cycle.
 *
 * Members are checked in arrival order. A member larger than its counterparty's exposure
 * cap can never be batched. Otherwise its gross amount is charged against the window's
 * liquidity cap for its source currency; once the cap would be exceeded the member is
 * deferred and later, smaller members may still fit.
 */
public class ConstraintScreen {

    private final SettlementLimitProvider limits;

    public ConstraintScreen(SettlementLimitProvider limits) {
        this.limits = limits;
    }

    public Screening screen(Chunk chunk) {
        Map<String, BigDecimal> remainingLiquidity = new HashMap<>();
        List<TransactionIntent> admitted = new ArrayList<>();
        List<TransactionIntent> deferred = new ArrayList<>();
        Map<String, DeferralReason> reasons = new LinkedHashMap<>();

        for (TransactionIntent intent : chunk.getMembers()) {
            BigDecimal amount = intent.getAmount();
            if (amount.compareTo(limits.exposureCap(intent.getCounterpartyId())) > 0) {
                deferred.add(intent);
                reasons.put(intent.getTransactionId(), DeferralReason.EXPOSURE_CAP_EXCEEDED);
                continue;
            }

            String currency = intent.getSourceCurrency();
            Optional<BigDecimal> cap = limits.liquidityCap(chunk.getWindow(), currency);
            if (cap.isPresent()) {
                BigDecimal remaining = remainingLiquidity.computeIfAbsent(currency, c -> cap.get());
                if (amount.compareTo(remaining) > 0) {
                    deferred.add(intent);
                    reasons.put(intent.getTransactionId(), DeferralReason.LIQUIDITY_BREACH);
                    continue;
                }
                remainingLiquidity.put(currency, remaining.subtract(amount));
            }
            admitted.add(intent);
        }
        return new Screening(Collections.unmodifiableList(admitted), Collections.unmodifiableList(deferred),
                Collections.unmodifiableMap(reasons));
    }

    @Value
    public static class Screening {
        List<TransactionIntent> admitted;
        List<TransactionIntent> deferred;
        Map<String, DeferralReason> reasons;

        public boolean hasDeferred() {
            return !deferred.isEmpty();
        }
    }
}
