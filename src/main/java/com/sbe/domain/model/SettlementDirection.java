package com.sbe.domain.model;

import java.math.BigDecimal;

/**
 * Direction of an obligation relative to the settling institution.
 * PAY: we owe the counterparty. RECEIVE: the counterparty owes us.
 */
public enum SettlementDirection {
    PAY("PAY", 1),
    RECEIVE("RECEIVE", -1);

    private final String value;
    private final int sign;

    SettlementDirection(String value, int sign) {
        this.value = value;
        this.sign = sign;
    }

    public String getValue() {
        return value;
    }

    /**
     * Signed amount as seen from the counterparty: positive when it is owed money.
     */
    public BigDecimal signed(BigDecimal amount) {
        return sign > 0 ? amount : amount.negate();
    }

    public static SettlementDirection fromSignum(int signum) {
        if (signum == 0) {
            throw new IllegalArgumentException("A zero position has no direction");
        }
        return signum > 0 ? PAY : RECEIVE;
    }

    public static SettlementDirection fromValue(String value) {
        for (SettlementDirection direction : values()) {
            if (direction.value.equalsIgnoreCase(value)) {
                return direction;
            }
        }
        throw new IllegalArgumentException("Unknown settlement direction: " + value);
    }

    public static boolean isValid(String value) {
        for (SettlementDirection direction : values()) {
            if (direction.value.equalsIgnoreCase(value)) {
                return true;
            }
        }
        return false;
    }
}
