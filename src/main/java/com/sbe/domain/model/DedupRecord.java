package com.sbe.domain.model;

import lombok.Value;

import java.time.Instant;

/**
 * Cached admission outcome for one idempotency key, also reserving its transaction id
 *
 * @param <T> outcome type cached for replays
 */
@Value
public class DedupRecord<T> {
    String idempotencyKey;
    String transactionId;
    T outcome;
    Instant recordedAt;
    Instant expiresAt;

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
