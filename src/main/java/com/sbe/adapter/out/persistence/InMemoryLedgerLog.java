package com.sbe.adapter.out.persistence;

import com.sbe.application.port.out.LedgerLog;
import com.sbe.domain.event.LedgerEvent;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only event log held in memory.
 * A redelivered event is acknowledged with its original offset and not stored twice.
 * An event id reused by a different event (an id re-admitted after its retention window)
 * is stored as a new entry.
 */
@Slf4j
public class InMemoryLedgerLog implements LedgerLog {

    private final List<LedgerEvent> entries = new ArrayList<>();
    private final Map<String, Long> offsetsByEventId = new HashMap<>();

    @Override
    public synchronized Future<Long> append(LedgerEvent event) {
        Long existing = offsetsByEventId.get(event.getEventId());
        if (existing != null && entries.get(existing.intValue()).equals(event)) {
            log.debug("Event {} already at offset {}", event.getEventId(), existing);
            return Future.succeededFuture(existing);
        }
        if (existing != null) {
            log.warn("Event id {} reused by a new event, storing it after offset {}", event.getEventId(), existing);
        }
        long offset = entries.size();
        entries.add(event);
        offsetsByEventId.put(event.getEventId(), offset);
        return Future.succeededFuture(offset);
    }

    @Override
    public synchronized Future<List<LedgerEntry>> replay(long fromOffset) {
        List<LedgerEntry> result = new ArrayList<>();
        for (long offset = Math.max(0, fromOffset); offset < entries.size(); offset++) {
            result.add(new LedgerEntry(offset, entries.get((int) offset)));
        }
        return Future.succeededFuture(result);
    }

    public synchronized int size() {
        return entries.size();
    }
}
