package com.sbe.adapter.out.config;

import com.sbe.application.port.out.SettlementLimitProvider;
import com.sbe.domain.model.SettlementWindow;
import io.vertx.core.json.JsonObject;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Exposure and liquidity limits read from the "limits" section of application.yml.
 * Counterparties without an explicit cap get the default cap.
 */
@Slf4j
public class ConfiguredSettlementLimitAdapter implements SettlementLimitProvider {

    private final BigDecimal defaultExposureCap;
    private final Map<String, BigDecimal> exposureCaps;
    private final Map<SettlementWindow, Map<String, BigDecimal>> liquidityCaps;

    public ConfiguredSettlementLimitAdapter(
            BigDecimal defaultExposureCap,
            Map<String, BigDecimal> exposureCaps,
            Map<SettlementWindow, Map<String, BigDecimal>> liquidityCaps
    ) {
        this.defaultExposureCap = defaultExposureCap;
        this.exposureCaps = Map.copyOf(exposureCaps);
        this.liquidityCaps = new EnumMap<>(SettlementWindow.class);
        liquidityCaps.forEach((window, caps) -> this.liquidityCaps.put(window, Map.copyOf(caps)));
    }

    public static ConfiguredSettlementLimitAdapter fromConfig(JsonObject config) {
        JsonObject limits = config.getJsonObject("limits", new JsonObject());
        Object defaultCap = limits.getValue("defaultExposureCap");
        if (defaultCap == null) {
            throw new IllegalStateException("limits.defaultExposureCap is required");
        }

        Map<String, BigDecimal> exposureCaps = new HashMap<>();
        JsonObject perCounterparty = limits.getJsonObject("exposureCaps", new JsonObject());
        for (String counterpartyId : perCounterparty.fieldNames()) {
            exposureCaps.put(counterpartyId, new BigDecimal(perCounterparty.getValue(counterpartyId).toString()));
        }

        Map<SettlementWindow, Map<String, BigDecimal>> liquidityCaps = new EnumMap<>(SettlementWindow.class);
        JsonObject perWindow = limits.getJsonObject("liquidityCaps", new JsonObject());
        for (String windowKey : perWindow.fieldNames()) {
            JsonObject perCurrency = perWindow.getJsonObject(windowKey);
            Map<String, BigDecimal> caps = new HashMap<>();
            for (String currency : perCurrency.fieldNames()) {
                caps.put(currency, new BigDecimal(perCurrency.getValue(currency).toString()));
            }
            liquidityCaps.put(SettlementWindow.fromValue(windowKey), caps);
        }

        log.info("Loaded limits: default exposure cap {}, {} counterparty caps, liquidity caps for {} windows",
                defaultCap, exposureCaps.size(), liquidityCaps.size());
        return new ConfiguredSettlementLimitAdapter(new BigDecimal(defaultCap.toString()), exposureCaps, liquidityCaps);
    }

    @Override
    public BigDecimal exposureCap(String counterpartyId) {
        return exposureCaps.getOrDefault(counterpartyId, defaultExposureCap);
    }

    @Override
    public Optional<BigDecimal> liquidityCap(SettlementWindow window, String currency) {
        Map<String, BigDecimal> caps = liquidityCaps.get(window);
        return caps == null ? Optional.empty() : Optional.ofNullable(caps.get(currency));
    }
}
