package com.sbe.adapter.in.web.submission;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * DTO for an incoming payment instruction
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TransactionSubmissionRequest(
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
) {
    @JsonCreator
    public TransactionSubmissionRequest(
            @JsonProperty("transactionId") String transactionId,
            @JsonProperty("amount") BigDecimal amount,
            @JsonProperty("sourceCurrency") String sourceCurrency,
            @JsonProperty("destinationCurrency") String destinationCurrency,
            @JsonProperty("sourceAccount") String sourceAccount,
            @JsonProperty("destinationAccount") String destinationAccount,
            @JsonProperty("counterpartyId") String counterpartyId,
            @JsonProperty("idempotencyKey") String idempotencyKey,
            @JsonProperty("settlementWindow") String settlementWindow,
            @JsonProperty("direction") String direction
    ) {
        this.transactionId = transactionId;
        this.amount = amount;
        this.sourceCurrency = sourceCurrency;
        this.destinationCurrency = destinationCurrency;
        this.sourceAccount = sourceAccount;
        this.destinationAccount = destinationAccount;
        this.counterpartyId = counterpartyId;
        this.idempotencyKey = idempotencyKey;
        this.settlementWindow = settlementWindow;
        this.direction = direction;
    }
}
