package com.sbe.adapter.in.web;

import com.sbe.adapter.in.web.query.BatchQueryHandler;
import com.sbe.adapter.in.web.query.LedgerReplayHandler;
import com.sbe.adapter.in.web.query.TransactionStatusHandler;
import com.sbe.adapter.in.web.submission.TransactionSubmissionHandler;
import com.sbe.application.service.admission.DedupRetentionService;
import com.sbe.infrastructure.config.SettlementModule;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.http.HttpServer;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.handler.LoggerHandler;
import lombok.extern.slf4j.Slf4j;

/**
 * HTTP Server Verticle - serves submission and query endpoints
 */
@Slf4j
public class HttpServerVerticle extends AbstractVerticle {

    private static final int DEFAULT_PORT = 8081;

    private final SettlementModule module;
    private DedupRetentionService retentionService;
    private HttpServer server;

    public HttpServerVerticle(SettlementModule module) {
        this.module = module;
    }

    @Override
    public void start(Promise<Void> startPromise) {
        log.info("Starting HTTP Server Verticle...");

        retentionService = module.getRetentionService();
        retentionService.startPeriodicPurge();

        startHttpServer()
                .onSuccess(v -> {
                    log.info("HTTP Server Verticle started successfully on port {}", actualPort());
                    startPromise.complete();
                })
                .onFailure(error -> {
                    log.error("Failed to start HTTP Server Verticle", error);
                    startPromise.fail(error);
                });
    }

    @Override
    public void stop() {
        if (retentionService != null) {
            retentionService.stopPeriodicPurge();
        }
        log.info("HTTP Server Verticle stopped");
    }

    /**
     * Port the server is bound to; differs from the configured one when that was 0
     */
    public int actualPort() {
        return server == null ? -1 : server.actualPort();
    }

    private Future<Void> startHttpServer() {
        Router router = Router.router(vertx);

        router.route().handler(LoggerHandler.create());

        WebRouter webRouter = new WebRouter(
                router,
                new TransactionSubmissionHandler(module.getAdmissionUseCase()),
                new TransactionStatusHandler(module.getQueryUseCase()),
                new BatchQueryHandler(module.getQueryUseCase()),
                new LedgerReplayHandler(module.getQueryUseCase())
        );
        webRouter.setupRoutes();

        // Default route - 404
        router.route().handler(ctx -> ErrorResponse.send(ctx, 404, ErrorResponse.of("Endpoint not found")));

        int port = getPort();

        return vertx.createHttpServer()
                .requestHandler(router)
                .listen(port)
                .onSuccess(listening -> {
                    server = listening;
                    log.info("HTTP server listening on port {}", listening.actualPort());
                })
                .mapEmpty();
    }

    private int getPort() {
        JsonObject http = config().getJsonObject("http", new JsonObject());
        return http.getInteger("port", DEFAULT_PORT);
    }
}
