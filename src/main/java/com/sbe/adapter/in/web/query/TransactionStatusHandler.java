package com.sbe.adapter.in.web.query;

import com.sbe.adapter.in.web.ErrorResponse;
import com.sbe.application.port.in.SettlementQueryUseCase;
import com.sbe.domain.model.TransactionState;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Handles GET /api/transactions/:transactionId
 */
@Slf4j
@RequiredArgsConstructor
public class TransactionStatusHandler implements Handler<RoutingContext> {

    private final SettlementQueryUseCase queryUseCase;

    @Override
    public void handle(RoutingContext context) {
        String transactionId = context.pathParam("transactionId");

        queryUseCase.findTransaction(transactionId)
                .onSuccess(state -> {
                    if (state.isEmpty()) {
                        ErrorResponse.send(context, 404, ErrorResponse.of("Transaction not found: " + transactionId));
                        return;
                    }
                    context.response()
                            .setStatusCode(200)
                            .putHeader("Content-Type", "application/json")
                            .end(toJson(state.get()).encode());
                })
                .onFailure(error -> {
                    log.error("Failed to load transaction {}", transactionId, error);
                    ErrorResponse.send(context, 500, ErrorResponse.of(error.getMessage()));
                });
    }

    private static JsonObject toJson(TransactionState state) {
        JsonObject json = new JsonObject()
                .put("transactionId", state.getTransactionId())
                .put("status", state.getStatus().getValue())
                .put("updatedAt", state.getUpdatedAt().toString());
        if (state.getBatchId() != null) {
            json.put("batchId", state.getBatchId());
        }
        return json;
    }
}
