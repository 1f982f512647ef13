package com.sbe.domain.event;

import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Ordered domain event. The sequence number increases monotonically per entity
 * (transaction id or batch id) so downstream consumers can drop redeliveries.
 */
@Value
public class LedgerEvent {
    String eventId;
    LedgerEventType type;
    String entityId;
    long sequence;
    Instant occurredAt;
    Map<String, Object> attributes;

    public static String eventId(String entityId, long sequence) {
        return entityId + "#" + sequence;
    }
}
