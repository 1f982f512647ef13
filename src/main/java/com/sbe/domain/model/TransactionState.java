package com.sbe.domain.model;

import lombok.Value;

import java.time.Instant;

/**
 * Latest known status of a transaction and the batch that holds it, if any
 */
@Value
public class TransactionState {
    String transactionId;
    TransactionStatus status;
    String batchId;
    Instant updatedAt;
}
