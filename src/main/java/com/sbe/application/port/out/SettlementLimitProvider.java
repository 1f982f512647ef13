package com.sbe.application.port.out;

import com.sbe.domain.model.SettlementWindow;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Output port for exposure and liquidity limits
 */
public interface SettlementLimitProvider {

    /**
     * Maximum amount a single batch may carry for one counterparty
     */
    BigDecimal exposureCap(String counterpartyId);

    /**
     * Liquidity available in a currency for one chunk cycle of a window; empty means unlimited
     */
    Optional<BigDecimal> liquidityCap(SettlementWindow window, String currency);
}
