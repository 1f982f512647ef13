package com.sbe.adapter.in.web.submission;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.sbe.application.port.in.AdmissionOutcome.Accepted;

/**
 * Body returned for an accepted submission and, unchanged, for every replay of its key
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TransactionSubmissionResponse(
        String transactionId,
        String status
) {
    public static TransactionSubmissionResponse from(Accepted accepted) {
        return new TransactionSubmissionResponse(accepted.transactionId(), accepted.status());
    }
}
