package com.sbe.application.service.netting;

import com.sbe.domain.model.Batch;
import com.sbe.domain.model.NetTransfer;
import com.sbe.domain.model.NettingResult;
import com.sbe.domain.model.SettlementDirection;
import com.sbe.domain.model.TransactionIntent;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Multilateral netting within one batch.
 *
 * Positions are kept per currency and counterparty against the settling institution:
 * a PAY adds to what the counterparty is owed, a RECEIVE subtracts from it. Each
 * non-zero position becomes one net transfer. Currencies are never netted against each other.
 */
@Slf4j
public class NettingCalculator {

    public NettingResult net(Batch batch, Map<String, TransactionIntent> intents) {
        if (!batch.getStatus().isNettable()) {
            throw new IllegalArgumentException("Batch " + batch.getBatchId() + " is " + batch.getStatus()
                    + " and cannot be netted");
        }

        Map<String, Map<String, BigDecimal>> positions = new TreeMap<>();
        Map<String, Map<String, Integer>> flowCounts = new TreeMap<>();
        Map<String, BigDecimal> grossTotals = new TreeMap<>();

        for (String memberId : batch.getMemberIds()) {
            TransactionIntent intent = intents.get(memberId);
            if (intent == null) {
                throw new IllegalStateException("Batch " + batch.getBatchId() + " references unknown transaction " + memberId);
            }
            String currency = intent.getSourceCurrency();
            BigDecimal signed = intent.getSignedAmount();
            positions.computeIfAbsent(currency, c -> new TreeMap<>())
                    .merge(intent.getCounterpartyId(), signed, BigDecimal::add);
            flowCounts.computeIfAbsent(currency, c -> new TreeMap<>())
                    .merge(intent.getCounterpartyId(), 1, Integer::sum);
            grossTotals.merge(currency, signed, BigDecimal::add);
        }

        List<NetTransfer> transfers = new ArrayList<>();
        Map<String, BigDecimal> netTotals = new TreeMap<>();
        positions.forEach((currency, byCounterparty) -> {
            netTotals.put(currency, BigDecimal.ZERO);
            byCounterparty.forEach((counterpartyId, position) -> {
                if (position.signum() == 0) {
                    return;
                }
                SettlementDirection direction = SettlementDirection.fromSignum(position.signum());
                transfers.add(new NetTransfer(counterpartyId, currency, position.abs(), direction,
                        flowCounts.get(currency).get(counterpartyId)));
                netTotals.merge(currency, position, BigDecimal::add);
            });
        });

        grossTotals.forEach((currency, gross) -> {
            if (gross.compareTo(netTotals.get(currency)) != 0) {
                throw new IllegalStateException("Netting of batch " + batch.getBatchId() + " does not conserve "
                        + currency + ": gross " + gross + ", net " + netTotals.get(currency));
            }
        });

        log.debug("Netted batch {}: {} gross transfers into {} net transfers",
                batch.getBatchId(), batch.size(), transfers.size());
        return new NettingResult(batch.getBatchId(), Collections.unmodifiableList(transfers),
                Collections.unmodifiableMap(grossTotals), Collections.unmodifiableMap(netTotals), batch.size());
    }
}
