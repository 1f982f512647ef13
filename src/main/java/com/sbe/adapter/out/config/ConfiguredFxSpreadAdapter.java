package com.sbe.adapter.out.config;

import com.sbe.application.port.out.FxSpreadProvider;
import com.sbe.domain.model.CurrencyPair;
import io.vertx.core.json.JsonObject;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;

/**
 * FX spread table read from the "cost" section of application.yml.
 * Pairs are directional; unknown pairs are priced at the configured default.
 */
@Slf4j
public class ConfiguredFxSpreadAdapter implements FxSpreadProvider {

    private final Map<CurrencyPair, BigDecimal> spreads;
    private final BigDecimal defaultSpreadBps;

    public ConfiguredFxSpreadAdapter(Map<CurrencyPair, BigDecimal> spreads, BigDecimal defaultSpreadBps) {
        this.spreads = Map.copyOf(spreads);
        this.defaultSpreadBps = defaultSpreadBps;
    }

    public static ConfiguredFxSpreadAdapter fromConfig(JsonObject config) {
        JsonObject cost = config.getJsonObject("cost", new JsonObject());
        Object fallback = cost.getValue("defaultSpreadBps");
        if (fallback == null) {
            throw new IllegalStateException("cost.defaultSpreadBps is required");
        }

        Map<CurrencyPair, BigDecimal> spreads = new HashMap<>();
        JsonObject table = cost.getJsonObject("spreadsBps", new JsonObject());
        for (String key : table.fieldNames()) {
            spreads.put(CurrencyPair.parse(key), new BigDecimal(table.getValue(key).toString()));
        }

        log.info("Loaded {} FX spreads (default {} bps)", spreads.size(), fallback);
        return new ConfiguredFxSpreadAdapter(spreads, new BigDecimal(fallback.toString()));
    }

    @Override
    public BigDecimal spreadBps(CurrencyPair pair) {
        return spreads.getOrDefault(pair, defaultSpreadBps);
    }
}
