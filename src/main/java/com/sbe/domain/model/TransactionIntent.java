package com.sbe.domain.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A validated payment instruction. Immutable once admitted.
 */
@Value
@Builder
public class TransactionIntent {
    String transactionId;
    BigDecimal amount;
    String sourceCurrency;
    String destinationCurrency;
    String sourceAccount;
    String destinationAccount;
    String counterpartyId;
    SettlementWindow window;
    @Builder.Default
    SettlementDirection direction = SettlementDirection.PAY;
    String idempotencyKey;
    Instant submittedAt;

    public CurrencyPair getCurrencyPair() {
        return CurrencyPair.of(sourceCurrency, destinationCurrency);
    }

    /**
     * Amount signed from the counterparty's point of view
     */
    public BigDecimal getSignedAmount() {
        return direction.signed(amount);
    }
}
