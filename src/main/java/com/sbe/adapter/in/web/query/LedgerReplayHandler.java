package com.sbe.adapter.in.web.query;

import com.sbe.adapter.in.web.ErrorResponse;
import com.sbe.application.port.in.SettlementQueryUseCase;
import com.sbe.application.port.out.LedgerLog.LedgerEntry;
import com.sbe.domain.event.LedgerEvent;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.List;

/**
 * Handles GET /api/ledger/events?fromOffset=N
 */
@Slf4j
@RequiredArgsConstructor
public class LedgerReplayHandler implements Handler<RoutingContext> {

    private final SettlementQueryUseCase queryUseCase;

    @Override
    public void handle(RoutingContext context) {
        long fromOffset;
        try {
            List<String> param = context.queryParam("fromOffset");
            fromOffset = param.isEmpty() ? 0 : Long.parseLong(param.get(0));
        } catch (NumberFormatException e) {
            ErrorResponse.send(context, 400, ErrorResponse.of("fromOffset must be a number"));
            return;
        }

        queryUseCase.replayLedger(fromOffset)
                .onSuccess(entries -> {
                    JsonArray events = new JsonArray();
                    entries.forEach(entry -> events.add(toJson(entry)));
                    context.response()
                            .setStatusCode(200)
                            .putHeader("Content-Type", "application/json")
                            .end(new JsonObject().put("fromOffset", fromOffset).put("events", events).encode());
                })
                .onFailure(error -> {
                    int statusCode = error instanceof IllegalArgumentException ? 400 : 500;
                    if (statusCode == 500) {
                        log.error("Ledger replay from {} failed", fromOffset, error);
                    }
                    ErrorResponse.send(context, statusCode, ErrorResponse.of(error.getMessage()));
                });
    }

    private static JsonObject toJson(LedgerEntry entry) {
        LedgerEvent event = entry.event();
        return new JsonObject()
                .put("offset", entry.offset())
                .put("eventId", event.getEventId())
                .put("type", event.getType().name())
                .put("entityId", event.getEntityId())
                .put("sequence", event.getSequence())
                .put("occurredAt", event.getOccurredAt().toString())
                .put("attributes", new JsonObject(new HashMap<>(event.getAttributes())));
    }
}
