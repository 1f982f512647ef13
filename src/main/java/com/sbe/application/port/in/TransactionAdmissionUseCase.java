package com.sbe.application.port.in;

import java.math.BigDecimal;

/**
 * Input port for transaction submission.
 * Runs on the request path and never waits on batching activity.
 */
public interface TransactionAdmissionUseCase {

    /**
     * Validate, deduplicate and hand the transaction downstream
     * @param command raw submission fields
     * @return Accepted, Duplicate or Rejected
     */
    AdmissionOutcome admit(AdmissionCommand command);

    /**
     * Command object for transaction submission
     */
    record AdmissionCommand(
            String transactionId,
            BigDecimal amount,
            String sourceCurrency,
            String destinationCurrency,
            String sourceAccount,
            String destinationAccount,
            String counterpartyId,
            String idempotencyKey,
            String settlementWindow,
            String direction
    ) {}
}
