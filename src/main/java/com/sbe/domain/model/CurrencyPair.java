package com.sbe.domain.model;

import lombok.Value;

/**
 * Ordered currency pair (source to destination). USD/EUR and EUR/USD are different pairs.
 */
@Value
public class CurrencyPair {
    String source;
    String destination;

    public static CurrencyPair of(String source, String destination) {
        return new CurrencyPair(source, destination);
    }

    /**
     * Parse the "SRC/DST" form used in configuration keys
     */
    public static CurrencyPair parse(String value) {
        String[] parts = value.split("/");
        if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
            throw new IllegalArgumentException("Currency pair must look like SRC/DST: " + value);
        }
        return new CurrencyPair(parts[0].trim(), parts[1].trim());
    }

    @Override
    public String toString() {
        return source + "/" + destination;
    }
}
