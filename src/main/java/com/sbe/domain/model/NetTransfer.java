package com.sbe.domain.model;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Single net transfer replacing a counterparty's gross flows in one currency
 */
@Value
public class NetTransfer {
    String counterpartyId;
    String currency;
    BigDecimal amount;
    SettlementDirection direction;
    int grossFlowCount;

    public BigDecimal getSignedAmount() {
        return direction.signed(amount);
    }
}
