package com.sbe.domain.model;

import lombok.Value;

/**
 * Identity of a batching queue: one settlement window and one ordered currency pair
 */
@Value
public class QueueKey {
    SettlementWindow window;
    CurrencyPair pair;

    public static QueueKey of(TransactionIntent intent) {
        return new QueueKey(intent.getWindow(), intent.getCurrencyPair());
    }

    @Override
    public String toString() {
        return window.getValue() + ":" + pair;
    }
}
