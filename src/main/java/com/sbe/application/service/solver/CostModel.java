package com.sbe.application.service.solver;

import com.sbe.application.port.out.FxSpreadProvider;
import com.sbe.domain.model.CostBreakdown;
import com.sbe.domain.model.TransactionIntent;
import lombok.Value;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Prices a set of transactions settled together.
 *
 * <ul>
 *   <li>FX spread: amount * spreadBps / 10000 for every transaction</li>
 *   <li>Wire: one wire per (counterparty, source currency) group</li>
 *   <li>Discount: rate * (group FX cost + wire) for every group of two or more</li>
 * </ul>
 *
 * All arithmetic is exact.
 */
public class CostModel {

    private final FxSpreadProvider spreads;
    private final BigDecimal wireCost;
    private final BigDecimal discountRate;

    public CostModel(FxSpreadProvider spreads, BigDecimal wireCost, BigDecimal discountRate) {
        if (wireCost.signum() < 0) {
            throw new IllegalArgumentException("wireCost must not be negative: " + wireCost);
        }
        if (discountRate.signum() < 0 || discountRate.compareTo(BigDecimal.ONE) >= 0) {
            throw new IllegalArgumentException("consolidationDiscountRate must be in [0, 1): " + discountRate);
        }
        this.spreads = spreads;
        this.wireCost = wireCost;
        this.discountRate = discountRate;
    }

    public BigDecimal fxCost(TransactionIntent intent) {
        return intent.getAmount().multiply(spreads.spreadBps(intent.getCurrencyPair())).movePointLeft(4);
    }

    /**
     * Cost of one wire group. All members must share the same {@link WireKey}.
     */
    public CostBreakdown priceGroup(List<TransactionIntent> group) {
        if (group.isEmpty()) {
            return CostBreakdown.ZERO;
        }
        BigDecimal fx = BigDecimal.ZERO;
        for (TransactionIntent intent : group) {
            fx = fx.add(fxCost(intent));
        }
        BigDecimal discount = group.size() >= 2 ? discountRate.multiply(fx.add(wireCost)) : BigDecimal.ZERO;
        return new CostBreakdown(fx, wireCost, discount, 1);
    }

    public CostBreakdown priceBatch(List<TransactionIntent> members) {
        CostBreakdown total = CostBreakdown.ZERO;
        for (List<TransactionIntent> group : byWireKey(members).values()) {
            total = total.plus(priceGroup(group));
        }
        return total;
    }

    /**
     * Lowest possible cost of settling {@code fxTotal} worth of spread in {@code groups} wires:
     * every group discounted, i.e. (fxTotal + groups * wire) * (1 - rate)
     */
    public BigDecimal groupingFloor(int groups, BigDecimal fxTotal) {
        BigDecimal wires = wireCost.multiply(BigDecimal.valueOf(groups));
        return fxTotal.add(wires).multiply(BigDecimal.ONE.subtract(discountRate));
    }

    public static Map<WireKey, List<TransactionIntent>> byWireKey(List<TransactionIntent> members) {
        Map<WireKey, List<TransactionIntent>> groups = new LinkedHashMap<>();
        for (TransactionIntent intent : members) {
            groups.computeIfAbsent(WireKey.of(intent), k -> new ArrayList<>()).add(intent);
        }
        return groups;
    }

    /**
     * Transactions sharing a wire key travel on one wire when batched together
     */
    @Value
    public static class WireKey {
        String counterpartyId;
        String currency;

        public static WireKey of(TransactionIntent intent) {
            return new WireKey(intent.getCounterpartyId(), intent.getSourceCurrency());
        }
    }
}
