package com.sbe.application.port.out;

import com.sbe.domain.event.LedgerEvent;
import io.vertx.core.Future;

import java.util.List;

/**
 * Output port for the external append-only, replayable event log.
 * Appends are at-least-once; event ids make redelivery detectable.
 */
public interface LedgerLog {

    /**
     * @return offset assigned to the event
     */
    Future<Long> append(LedgerEvent event);

    /**
     * @return events at or after the given offset, in log order
     */
    Future<List<LedgerEntry>> replay(long fromOffset);

    record LedgerEntry(long offset, LedgerEvent event) {}
}
