package com.sbe.domain.model;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Settlement cost of a batch: FX spread + wires - consolidation discount
 */
@Value
public class CostBreakdown {
    public static final CostBreakdown ZERO = new CostBreakdown(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, 0);

    BigDecimal fxSpreadCost;
    BigDecimal wireCost;
    BigDecimal consolidationDiscount;
    int wireCount;

    public BigDecimal getTotalCost() {
        return fxSpreadCost.add(wireCost).subtract(consolidationDiscount);
    }

    public CostBreakdown plus(CostBreakdown other) {
        return new CostBreakdown(
                fxSpreadCost.add(other.fxSpreadCost),
                wireCost.add(other.wireCost),
                consolidationDiscount.add(other.consolidationDiscount),
                wireCount + other.wireCount
        );
    }
}
