package com.sbe.application.config;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Tunables for admission, chunking, solving, pricing and ledger hand-off.
 * Defaults apply when application.yml leaves a key out.
 */
@Value
@Builder(toBuilder = true)
public class BatchingProperties {

    @Builder.Default
    int maxBatchSize = 1000;

    @Builder.Default
    int maxChunkSize = 1000;

    @Builder.Default
    Duration batchTimeout = Duration.ofSeconds(2);

    /** How often queues are checked for an expired batching timeout. */
    @Builder.Default
    Duration tickInterval = Duration.ofMillis(250);

    /** Transactions admitted but not yet terminally batched. */
    @Builder.Default
    int maxInFlightTransactions = 100_000;

    @Builder.Default
    int maxDeferralAttempts = 3;

    @Builder.Default
    Duration dedupRetention = Duration.ofHours(24);

    @Builder.Default
    Duration dedupPurgeInterval = Duration.ofMinutes(10);

    @Builder.Default
    Duration solverTimeBudget = Duration.ofMillis(100);

    @Builder.Default
    long maxSearchNodes = 200_000;

    /** Counterparty groups larger than this are packed heuristically, not searched. */
    @Builder.Default
    int maxExactGroupSize = 24;

    @Builder.Default
    BigDecimal wireCost = new BigDecimal("5.00");

    @Builder.Default
    BigDecimal consolidationDiscountRate = new BigDecimal("0.15");

    @Builder.Default
    int maxAppendAttempts = 5;

    @Builder.Default
    Duration initialAppendBackoff = Duration.ofMillis(50);

    public static BatchingProperties defaults() {
        return BatchingProperties.builder().build();
    }
}
