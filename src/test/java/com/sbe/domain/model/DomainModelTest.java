package com.sbe.domain.model;

import com.sbe.support.Intents;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for value types and their invariants
 */
class DomainModelTest {

    @Test
    void currencyPair_isDirectional() {
        assertNotEquals(CurrencyPair.of("USD", "EUR"), CurrencyPair.of("EUR", "USD"));
        assertEquals(CurrencyPair.of("USD", "EUR"), CurrencyPair.parse("USD/EUR"));
        assertEquals("USD/EUR", CurrencyPair.of("USD", "EUR").toString());
        assertThrows(IllegalArgumentException.class, () -> CurrencyPair.parse("USDEUR"));
    }

    @Test
    void queueKey_separatesWindows() {
        TransactionIntent rtgs = Intents.builder("A").build();
        TransactionIntent t1 = Intents.builder("B").window(SettlementWindow.T1).build();

        assertNotEquals(QueueKey.of(rtgs), QueueKey.of(t1));
        assertEquals("rtgs:USD/EUR", QueueKey.of(rtgs).toString());
    }

    @Test
    void chunk_rejectsMembersOfAnotherQueue() {
        TransactionIntent usdEur = Intents.builder("A").build();
        TransactionIntent eurUsd = Intents.builder("B").sourceCurrency("EUR").destinationCurrency("USD").build();

        assertThrows(IllegalArgumentException.class,
                () -> new Chunk("c1", QueueKey.of(usdEur), List.of(usdEur, eurUsd), Intents.T0));
    }

    @Test
    void chunk_keepsArrivalOrder() {
        Chunk chunk = Intents.chunk("c1", List.of(
                Intents.pay("A", "CP-1", "1.00"),
                Intents.pay("B", "CP-2", "2.00"),
                Intents.pay("C", "CP-1", "3.00")));

        assertEquals(List.of("A", "B", "C"), chunk.memberIds());
        assertEquals(3, chunk.membersById().size());
    }

    @Test
    void costBreakdown_totalIsSpreadPlusWiresMinusDiscount() {
        CostBreakdown cost = new CostBreakdown(new BigDecimal("1.50"), new BigDecimal("10.00"), new BigDecimal("0.75"), 2);

        assertEquals(0, new BigDecimal("10.75").compareTo(cost.getTotalCost()));
        assertEquals(0, cost.getTotalCost().compareTo(cost.plus(CostBreakdown.ZERO).getTotalCost()));
        assertEquals(2, cost.plus(CostBreakdown.ZERO).getWireCount());
    }

    @Test
    void batch_canBeNettedOnlyOnce() {
        Batch batch = Batch.builder()
                .batchId("c1-b01")
                .chunkId("c1")
                .window(SettlementWindow.RTGS)
                .pair(CurrencyPair.of("USD", "EUR"))
                .memberIds(List.of("A"))
                .grossSubtotals(Map.of("USD", new BigDecimal("1.00")))
                .cost(CostBreakdown.ZERO)
                .status(BatchStatus.OPTIMAL)
                .deferralReasons(Map.of())
                .build();
        NettingResult netting = new NettingResult("c1-b01", List.of(), Map.of(), Map.of(), 1);

        Batch netted = batch.withNetting(netting);

        assertTrue(netted.isNetted());
        assertFalse(batch.isNetted());
        assertThrows(IllegalStateException.class, () -> netted.withNetting(netting));
        assertThrows(IllegalStateException.class,
                () -> batch.toBuilder().status(BatchStatus.INFEASIBLE).build().withNetting(netting));
    }

    @Test
    void dedupRecord_expiresAtHorizon() {
        DedupRecord<String> record = new DedupRecord<>("K1", "T1", "outcome", Intents.T0, Intents.T0.plusSeconds(60));

        assertFalse(record.isExpired(Intents.T0.plusSeconds(59)));
        assertTrue(record.isExpired(Intents.T0.plusSeconds(60)));
    }
}
