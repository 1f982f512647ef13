package com.sbe;

import com.sbe.adapter.in.eventbus.BatchingVerticle;
import com.sbe.adapter.in.web.HttpServerVerticle;
import com.sbe.domain.model.TransactionIntent;
import com.sbe.infrastructure.config.AppConfigLoader;
import com.sbe.infrastructure.config.SettlementModule;
import com.sbe.infrastructure.config.TransactionIntentCodec;
import io.vertx.core.DeploymentOptions;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main application entry point
 */
public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        log.info("Starting Settlement Batching Engine...");

        VertxOptions options = new VertxOptions()
                .setWorkerPoolSize(10)
                .setEventLoopPoolSize(4);

        Vertx vertx = Vertx.vertx(options);

        vertx.eventBus().registerDefaultCodec(TransactionIntent.class, new TransactionIntentCodec());
        log.info("Registered TransactionIntent message codec");

        JsonObject config = AppConfigLoader.load("application.yml");
        SettlementModule module = SettlementModule.create(vertx, config);
        DeploymentOptions deploymentOptions = new DeploymentOptions().setConfig(config);

        // batching first, so the intent consumer exists before the first submission
        vertx.deployVerticle(new BatchingVerticle(module), deploymentOptions)
                .compose(batchingId -> vertx.deployVerticle(new HttpServerVerticle(module), deploymentOptions))
                .onSuccess(deploymentId -> {
                    log.info("Verticles deployed successfully");

                    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                        log.info("Shutting down Settlement Batching Engine...");
                        vertx.close();
                    }));

                    int port = config.getJsonObject("http", new JsonObject()).getInteger("port", 8081);
                    log.info("Settlement Batching Engine is ready!");
                    log.info("API Endpoint: http://localhost:{}/api/transactions", port);
                    log.info("Health Check: http://localhost:{}/health", port);
                })
                .onFailure(error -> {
                    log.error("Failed to deploy verticles", error);
                    vertx.close();
                });
    }
}
