package com.sbe.domain.model;

/**
 * Settlement timing class. Transactions of different windows never share a batch.
 */
public enum SettlementWindow {
    RTGS("rtgs"),   // real-time gross settlement
    T0("t0"),       // same day
    T1("t1"),       // next day
    T2("t2");

    private final String value;

    SettlementWindow(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static SettlementWindow fromValue(String value) {
        for (SettlementWindow window : values()) {
            if (window.value.equalsIgnoreCase(value) || window.name().equalsIgnoreCase(value)) {
                return window;
            }
        }
        throw new IllegalArgumentException("Unknown settlement window: " + value);
    }

    public static boolean isValid(String value) {
        if (value == null) {
            return false;
        }
        for (SettlementWindow window : values()) {
            if (window.value.equalsIgnoreCase(value) || window.name().equalsIgnoreCase(value)) {
                return true;
            }
        }
        return false;
    }
}
