package com.sbe.adapter.in.web;

import com.sbe.adapter.in.web.query.BatchQueryHandler;
import com.sbe.adapter.in.web.query.LedgerReplayHandler;
import com.sbe.adapter.in.web.query.TransactionStatusHandler;
import com.sbe.adapter.in.web.submission.TransactionSubmissionHandler;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.handler.BodyHandler;
import lombok.RequiredArgsConstructor;

/**
 * Router configuration for settlement endpoints
 */
@RequiredArgsConstructor
public class WebRouter {

    private final Router router;
    private final TransactionSubmissionHandler submissionHandler;
    private final TransactionStatusHandler transactionStatusHandler;
    private final BatchQueryHandler batchQueryHandler;
    private final LedgerReplayHandler ledgerReplayHandler;

    public void setupRoutes() {
        // CORS headers
        router.route().handler(ctx -> {
            ctx.response()
                    .putHeader("Access-Control-Allow-Origin", "*")
                    .putHeader("Access-Control-Allow-Methods", "GET, POST, OPTIONS")
                    .putHeader("Access-Control-Allow-Headers", "Content-Type, Authorization, X-Requested-With");
            ctx.next();
        });

        router.options("/api/transactions").handler(ctx -> ctx.response().setStatusCode(204).end());

        router.post("/api/transactions")
                .handler(BodyHandler.create())
                .handler(submissionHandler);

        router.get("/api/transactions/:transactionId").handler(transactionStatusHandler);
        router.get("/api/batches/:batchId").handler(batchQueryHandler);
        router.get("/api/ledger/events").handler(ledgerReplayHandler);

        router.get("/health")
                .handler(ctx -> ctx.response()
                        .putHeader("Content-Type", "application/json")
                        .end("{\"status\":\"UP\",\"service\":\"settlement-batching-engine\"}"));

        router.get("/")
                .handler(ctx -> ctx.response()
                        .putHeader("Content-Type", "application/json")
                        .end("{\"name\":\"Settlement Batching Engine\",\"version\":\"1.0.0\"}"));
    }
}
