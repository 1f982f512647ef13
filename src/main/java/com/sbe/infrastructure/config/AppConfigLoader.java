package com.sbe.infrastructure.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.sbe.application.config.BatchingProperties;
import io.vertx.core.json.JsonObject;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.Map;

/**
 * Loads application.yml from the classpath into a Vert.x JsonObject
 * and derives the typed batching properties from it.
 */
@Slf4j
public final class AppConfigLoader {

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private AppConfigLoader() {
    }

    public static JsonObject load(String resource) {
        try (InputStream is = AppConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IllegalStateException(resource + " not found in classpath");
            }
            Map<String, Object> tree = YAML.readValue(is, new TypeReference<Map<String, Object>>() {});
            JsonObject config = tree == null ? new JsonObject() : new JsonObject(tree);
            log.info("Loaded configuration from {}", resource);
            return config;
        } catch (IOException e) {
            throw new IllegalStateException("Configuration error: cannot read " + resource, e);
        }
    }

    public static BatchingProperties batchingProperties(JsonObject config) {
        BatchingProperties defaults = BatchingProperties.defaults();
        JsonObject batching = section(config, "batching");
        JsonObject dedup = section(config, "dedup");
        JsonObject solver = section(config, "solver");
        JsonObject cost = section(config, "cost");
        JsonObject ledger = section(config, "ledger");

        return BatchingProperties.builder()
                .maxBatchSize(batching.getInteger("maxBatchSize", defaults.getMaxBatchSize()))
                .maxChunkSize(batching.getInteger("maxChunkSize", defaults.getMaxChunkSize()))
                .batchTimeout(millis(batching, "batchTimeoutMs", defaults.getBatchTimeout()))
                .tickInterval(millis(batching, "tickIntervalMs", defaults.getTickInterval()))
                .maxInFlightTransactions(batching.getInteger("maxInFlightTransactions", defaults.getMaxInFlightTransactions()))
                .maxDeferralAttempts(batching.getInteger("maxDeferralAttempts", defaults.getMaxDeferralAttempts()))
                .dedupRetention(Duration.ofHours(dedup.getLong("retentionHours", defaults.getDedupRetention().toHours())))
                .dedupPurgeInterval(millis(dedup, "purgeIntervalMs", defaults.getDedupPurgeInterval()))
                .solverTimeBudget(millis(solver, "timeBudgetMs", defaults.getSolverTimeBudget()))
                .maxSearchNodes(solver.getLong("maxSearchNodes", defaults.getMaxSearchNodes()))
                .maxExactGroupSize(solver.getInteger("maxExactGroupSize", defaults.getMaxExactGroupSize()))
                .wireCost(decimal(cost.getValue("wireCost"), defaults.getWireCost()))
                .consolidationDiscountRate(decimal(cost.getValue("consolidationDiscountRate"),
                        defaults.getConsolidationDiscountRate()))
                .maxAppendAttempts(ledger.getInteger("maxAppendAttempts", defaults.getMaxAppendAttempts()))
                .initialAppendBackoff(millis(ledger, "initialBackoffMs", defaults.getInitialAppendBackoff()))
                .build();
    }

    static JsonObject section(JsonObject config, String name) {
        JsonObject section = config.getJsonObject(name);
        return section == null ? new JsonObject() : section;
    }

    /**
     * YAML numbers arrive as Integer or Double; go through the string form to keep 2.5 exact
     */
    static BigDecimal decimal(Object value, BigDecimal fallback) {
        if (value == null) {
            return fallback;
        }
        return new BigDecimal(value.toString());
    }

    private static Duration millis(JsonObject section, String key, Duration fallback) {
        Long value = section.getLong(key);
        return value == null ? fallback : Duration.ofMillis(value);
    }
}
