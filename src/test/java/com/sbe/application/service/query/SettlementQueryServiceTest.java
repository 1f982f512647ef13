package com.sbe.application.service.query;

import com.sbe.application.port.out.BatchRepository;
import com.sbe.application.port.out.LedgerLog;
import com.sbe.application.port.out.TransactionStatusRepository;
import com.sbe.domain.model.TransactionState;
import com.sbe.domain.model.TransactionStatus;
import com.sbe.support.Intents;
import io.vertx.core.Future;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit test for SettlementQueryService
 */
class SettlementQueryServiceTest {

    @Mock
    private BatchRepository batchRepository;

    @Mock
    private TransactionStatusRepository statusRepository;

    @Mock
    private LedgerLog ledgerLog;

    private SettlementQueryService service;
    private AutoCloseable mocks;

    @BeforeEach
    void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        service = new SettlementQueryService(batchRepository, statusRepository, ledgerLog);
    }

    @AfterEach
    void tearDown() throws Exception {
        mocks.close();
    }

    @Test
    void findTransaction_shouldDelegateToStatusRepository() {
        TransactionState state = new TransactionState("T1", TransactionStatus.DEFERRED, "c1-deferred", Intents.T0);
        when(statusRepository.findById("T1")).thenReturn(Future.succeededFuture(Optional.of(state)));

        Future<Optional<TransactionState>> result = service.findTransaction("T1");

        assertTrue(result.succeeded());
        assertEquals(Optional.of(state), result.result());
    }

    @Test
    void findBatch_shouldReturnEmptyForUnknownBatch() {
        when(batchRepository.findById("nope")).thenReturn(Future.succeededFuture(Optional.empty()));

        assertEquals(Optional.empty(), service.findBatch("nope").result());
    }

    @Test
    void replayLedger_shouldRejectNegativeOffset() {
        Future<List<LedgerLog.LedgerEntry>> result = service.replayLedger(-1);

        assertTrue(result.failed());
        assertInstanceOf(IllegalArgumentException.class, result.cause());
        verify(ledgerLog, never()).replay(anyLong());
    }
}
