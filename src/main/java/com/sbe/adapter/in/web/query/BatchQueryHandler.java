package com.sbe.adapter.in.web.query;

import com.sbe.adapter.in.web.ErrorResponse;
import com.sbe.application.port.in.SettlementQueryUseCase;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Handles GET /api/batches/:batchId
 */
@Slf4j
@RequiredArgsConstructor
public class BatchQueryHandler implements Handler<RoutingContext> {

    private final SettlementQueryUseCase queryUseCase;

    @Override
    public void handle(RoutingContext context) {
        String batchId = context.pathParam("batchId");

        queryUseCase.findBatch(batchId)
                .onSuccess(batch -> {
                    if (batch.isEmpty()) {
                        ErrorResponse.send(context, 404, ErrorResponse.of("Batch not found: " + batchId));
                        return;
                    }
                    context.response()
                            .setStatusCode(200)
                            .putHeader("Content-Type", "application/json")
                            .end(JsonObject.mapFrom(BatchQueryResponse.from(batch.get())).encode());
                })
                .onFailure(error -> {
                    log.error("Failed to load batch {}", batchId, error);
                    ErrorResponse.send(context, 500, ErrorResponse.of(error.getMessage()));
                });
    }
}
