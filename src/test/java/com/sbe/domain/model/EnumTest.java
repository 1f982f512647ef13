package com.sbe.domain.model;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for enums
 */
class EnumTest {

    @Test
    void testSettlementDirection() {
        assertEquals(SettlementDirection.PAY, SettlementDirection.fromValue("PAY"));
        assertEquals(SettlementDirection.RECEIVE, SettlementDirection.fromValue("receive"));

        assertTrue(SettlementDirection.isValid("pay"));
        assertFalse(SettlementDirection.isValid("INVALID"));
        assertThrows(IllegalArgumentException.class, () -> SettlementDirection.fromValue("INVALID"));

        // Signed from the counterparty's side
        assertEquals(new BigDecimal("10.00"), SettlementDirection.PAY.signed(new BigDecimal("10.00")));
        assertEquals(new BigDecimal("-10.00"), SettlementDirection.RECEIVE.signed(new BigDecimal("10.00")));
        assertEquals(SettlementDirection.PAY, SettlementDirection.fromSignum(1));
        assertEquals(SettlementDirection.RECEIVE, SettlementDirection.fromSignum(-1));
        assertThrows(IllegalArgumentException.class, () -> SettlementDirection.fromSignum(0));
    }

    @Test
    void testSettlementWindow() {
        assertEquals(SettlementWindow.RTGS, SettlementWindow.fromValue("rtgs"));
        assertEquals(SettlementWindow.T1, SettlementWindow.fromValue("T1"));
        assertEquals("t2", SettlementWindow.T2.getValue());

        assertTrue(SettlementWindow.isValid("t0"));
        assertFalse(SettlementWindow.isValid("t3"));
        assertFalse(SettlementWindow.isValid(null));
        assertThrows(IllegalArgumentException.class, () -> SettlementWindow.fromValue("weekly"));
    }

    @Test
    void testBatchStatus() {
        assertTrue(BatchStatus.OPTIMAL.isNettable());
        assertTrue(BatchStatus.FALLBACK.isNettable());
        assertFalse(BatchStatus.INFEASIBLE.isNettable());
    }

    @Test
    void testTransactionStatus() {
        assertEquals("submitted", TransactionStatus.SUBMITTED.getValue());
        assertEquals("deferred", TransactionStatus.DEFERRED.getValue());
        assertEquals("infeasible", TransactionStatus.INFEASIBLE.getValue());
    }
}
