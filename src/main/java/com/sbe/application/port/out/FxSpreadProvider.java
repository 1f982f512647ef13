package com.sbe.application.port.out;

import com.sbe.domain.model.CurrencyPair;

import java.math.BigDecimal;

/**
 * Output port for FX spread pricing
 */
public interface FxSpreadProvider {

    /**
     * @return spread in basis points for the ordered pair
     */
    BigDecimal spreadBps(CurrencyPair pair);
}
