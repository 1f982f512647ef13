package com.sbe.application.service.admission;

import com.sbe.adapter.out.persistence.InMemoryDedupStore;
import com.sbe.adapter.out.persistence.InMemoryLedgerLog;
import com.sbe.application.port.in.AdmissionOutcome;
import com.sbe.application.port.in.AdmissionOutcome.Accepted;
import com.sbe.application.port.in.AdmissionOutcome.Duplicate;
import com.sbe.application.port.in.AdmissionOutcome.Rejected;
import com.sbe.application.port.in.TransactionAdmissionUseCase.AdmissionCommand;
import com.sbe.application.port.out.DedupStore;
import com.sbe.application.port.out.IntentDispatcher;
import com.sbe.application.port.out.LedgerLog.LedgerEntry;
import com.sbe.application.port.out.TransactionStatusRepository;
import com.sbe.application.service.ledger.LedgerEmitter;
import com.sbe.domain.event.LedgerEventType;
import com.sbe.domain.model.DedupRecord;
import com.sbe.domain.model.SettlementWindow;
import com.sbe.domain.model.TransactionState;
import com.sbe.domain.model.TransactionStatus;
import com.sbe.support.Intents;
import com.sbe.support.MutableClock;
import io.vertx.core.Vertx;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Unit test for IdempotencyGate
 */
class IdempotencyGateTest {

    @Mock
    private LedgerEmitter ledgerEmitter;

    @Mock
    private TransactionStatusRepository statusRepository;

    @Mock
    private IntentDispatcher dispatcher;

    private MutableClock clock;
    private IntakeCapacity capacity;
    private InMemoryDedupStore<Accepted> dedupStore;
    private IdempotencyGate gate;
    private AutoCloseable mocks;

    @BeforeEach
    void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        clock = new MutableClock(Intents.T0);
        dedupStore = new InMemoryDedupStore<>();
        capacity = new IntakeCapacity(100);
        gate = newGate(capacity);
    }

    @AfterEach
    void tearDown() throws Exception {
        if (mocks != null) {
            mocks.close();
        }
    }

    @Test
    void admit_shouldAcceptAndDispatchNewTransaction() {
        // When
        AdmissionOutcome outcome = gate.admit(command("T1", "K1"));

        // Then
        Accepted accepted = assertInstanceOf(Accepted.class, outcome);
        assertEquals("T1", accepted.transactionId());
        assertEquals("submitted", accepted.status());
        assertEquals(SettlementWindow.RTGS, accepted.intent().getWindow());
        assertEquals(Intents.T0, accepted.intent().getSubmittedAt());
        assertEquals(1, capacity.inFlight());

        verify(dispatcher, times(1)).dispatch(accepted.intent());
        verify(ledgerEmitter, times(1)).emit(eq(LedgerEventType.SUBMITTED), eq("T1"), anyMap());

        ArgumentCaptor<TransactionState> state = ArgumentCaptor.forClass(TransactionState.class);
        verify(statusRepository).save(state.capture());
        assertEquals(TransactionStatus.SUBMITTED, state.getValue().getStatus());
    }

    @Test
    void admit_shouldReplayFirstOutcomeForSameKey() {
        // Given
        AdmissionOutcome first = gate.admit(command("T1", "K1"));

        // When
        AdmissionOutcome second = gate.admit(command("T1", "K1"));

        // Then
        Duplicate duplicate = assertInstanceOf(Duplicate.class, second);
        assertEquals(first, duplicate.prior());
        assertEquals(1, capacity.inFlight(), "a duplicate must not hold intake capacity");
        verify(dispatcher, times(1)).dispatch(any());
        verify(ledgerEmitter, times(1)).emit(eq(LedgerEventType.SUBMITTED), any(), anyMap());
        verify(ledgerEmitter, times(1)).emit(eq(LedgerEventType.DEDUPED), eq("T1"), anyMap());
    }

    @Test
    void admit_shouldReturnPriorOutcomeWhenKeyIsReusedWithDifferentPayload() {
        // Given
        gate.admit(command("T1", "K1"));

        // When
        AdmissionOutcome outcome = gate.admit(command("T2", "K1"));

        // Then
        Duplicate duplicate = assertInstanceOf(Duplicate.class, outcome);
        assertEquals("T1", duplicate.prior().transactionId());
        verify(dispatcher, times(1)).dispatch(any());
    }

    @Test
    void admit_shouldAcceptExactlyOnceUnderConcurrentReplays() throws Exception {
        // Given
        int submitters = 16;
        ExecutorService executor = Executors.newFixedThreadPool(submitters);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<AdmissionOutcome>> results = new ArrayList<>();

        try {
            for (int i = 0; i < submitters; i++) {
                Callable<AdmissionOutcome> submit = () -> {
                    start.await();
                    return gate.admit(command("T1", "K1"));
                };
                results.add(executor.submit(submit));
            }

            // When
            start.countDown();

            // Then
            int accepted = 0;
            List<Accepted> payloads = new ArrayList<>();
            for (Future<AdmissionOutcome> result : results) {
                AdmissionOutcome outcome = result.get(5, TimeUnit.SECONDS);
                if (outcome instanceof Accepted) {
                    accepted++;
                    payloads.add((Accepted) outcome);
                } else {
                    payloads.add(assertInstanceOf(Duplicate.class, outcome).prior());
                }
            }
            assertEquals(1, accepted);
            assertTrue(payloads.stream().allMatch(payloads.get(0)::equals), "every caller sees the same payload");
            assertEquals(1, capacity.inFlight());
            verify(ledgerEmitter, times(1)).emit(eq(LedgerEventType.SUBMITTED), eq("T1"), anyMap());
            verify(dispatcher, times(1)).dispatch(any());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void admit_shouldRejectInvalidWithoutRecordingTheKey() {
        // Given
        AdmissionCommand invalid = new AdmissionCommand("T1", new BigDecimal("-1"), "USD", "EUR",
                "ACC-1", "ACC-2", "CP-1", "K1", "rtgs", null);

        // When
        AdmissionOutcome rejected = gate.admit(invalid);
        AdmissionOutcome retried = gate.admit(command("T1", "K1"));

        // Then
        Rejected rejection = assertInstanceOf(Rejected.class, rejected);
        assertFalse(rejection.retryable());
        assertTrue(rejection.errors().contains("amount must be greater than 0"));
        assertInstanceOf(Accepted.class, retried);
        assertEquals(1, capacity.inFlight());
    }

    @Test
    void admit_shouldRejectRetryablyWhenIntakeIsSaturated() {
        // Given
        IdempotencyGate saturated = newGate(new IntakeCapacity(1));
        AdmissionOutcome first = saturated.admit(command("T1", "K1"));

        // When
        AdmissionOutcome second = saturated.admit(command("T2", "K2"));
        AdmissionOutcome replay = saturated.admit(command("T1", "K1"));

        // Then
        assertInstanceOf(Accepted.class, first);
        Rejected rejected = assertInstanceOf(Rejected.class, second);
        assertTrue(rejected.retryable());
        assertEquals(first, assertInstanceOf(Duplicate.class, replay).prior());
        verify(dispatcher, times(1)).dispatch(any());
    }

    @Test
    void admit_shouldTreatExpiredKeyAsUnseen() {
        // Given
        gate.admit(command("T1", "K1"));
        clock.advance(Duration.ofHours(24));

        // When
        AdmissionOutcome outcome = gate.admit(command("T1", "K1"));

        // Then
        assertInstanceOf(Accepted.class, outcome);
        verify(dispatcher, times(2)).dispatch(any());
    }

    @Test
    void admit_shouldRejectTransactionIdReusedUnderAnotherKey() {
        // Given
        AdmissionOutcome first = gate.admit(command("T1", "K1"));

        // When
        AdmissionOutcome reused = gate.admit(command("T1", "K2"));

        // Then
        assertInstanceOf(Accepted.class, first);
        Rejected rejected = assertInstanceOf(Rejected.class, reused);
        assertFalse(rejected.retryable());
        assertEquals(List.of("transactionId T1 was already submitted with a different idempotency key"), rejected.errors());
        assertTrue(dedupStore.find("K2", clock.instant()).isEmpty(), "the second key stays unrecorded");
        assertEquals(1, capacity.inFlight());
        verify(dispatcher, times(1)).dispatch(any());
        verify(ledgerEmitter, times(1)).emit(eq(LedgerEventType.SUBMITTED), eq("T1"), anyMap());
        verify(ledgerEmitter, times(0)).emit(eq(LedgerEventType.DEDUPED), any(), anyMap());
    }

    @Test
    void admit_shouldAcceptExpiredKeyUnderNewTransactionIdOnly() {
        // Given
        gate.admit(command("T1", "K1"));
        clock.advance(Duration.ofHours(24));
        gate.admit(command("T2", "K2"));

        // When
        AdmissionOutcome reusedLiveId = gate.admit(command("T2", "K1"));
        AdmissionOutcome freshId = gate.admit(command("T3", "K1"));

        // Then
        assertInstanceOf(Rejected.class, reusedLiveId);
        assertEquals("T3", assertInstanceOf(Accepted.class, freshId).transactionId());
    }

    @Test
    void admit_shouldSequenceSubmittedBeforeConcurrentReplay() throws Exception {
        // Given
        Vertx vertx = Vertx.vertx();
        InMemoryLedgerLog ledgerLog = new InMemoryLedgerLog();
        LedgerEmitter realEmitter = new LedgerEmitter(vertx, ledgerLog, clock, 3, Duration.ofMillis(1));
        CountDownLatch reserved = new CountDownLatch(1);
        CountDownLatch resume = new CountDownLatch(1);
        PausingDedupStore pausing = new PausingDedupStore(dedupStore, reserved, resume);
        IdempotencyGate pausedGate = new IdempotencyGate(new TransactionValidator(), pausing, capacity, realEmitter,
                statusRepository, dispatcher, clock, Duration.ofHours(24));

        try {
            Thread winner = new Thread(() -> pausedGate.admit(command("T1", "K1")));
            Thread replay = new Thread(() -> pausedGate.admit(command("T1", "K1")));
            winner.start();
            assertTrue(reserved.await(5, TimeUnit.SECONDS));

            // When
            replay.start();
            long deadline = System.currentTimeMillis() + 5000;
            while (replay.getState() != Thread.State.BLOCKED && System.currentTimeMillis() < deadline) {
                Thread.sleep(1);
            }
            assertEquals(Thread.State.BLOCKED, replay.getState(), "the replay waits on the reservation");
            resume.countDown();
            winner.join(5000);
            replay.join(5000);

            // Then
            while (ledgerLog.size() < 2 && System.currentTimeMillis() < deadline) {
                Thread.sleep(5);
            }
            List<LedgerEntry> entries = ledgerLog.replay(0).result();
            assertEquals(List.of("T1#1", "T1#2"), entries.stream().map(entry -> entry.event().getEventId()).toList());
            assertEquals(List.of(LedgerEventType.SUBMITTED, LedgerEventType.DEDUPED),
                    entries.stream().map(entry -> entry.event().getType()).toList());
            verify(dispatcher, times(1)).dispatch(any());
        } finally {
            resume.countDown();
            CountDownLatch closed = new CountDownLatch(1);
            vertx.close().onComplete(ar -> closed.countDown());
            closed.await(5, TimeUnit.SECONDS);
        }
    }

    private IdempotencyGate newGate(IntakeCapacity intakeCapacity) {
        return new IdempotencyGate(new TransactionValidator(), dedupStore, intakeCapacity, ledgerEmitter,
                statusRepository, dispatcher, clock, Duration.ofHours(24));
    }

    /**
     * Holds the first reservation open until released, so a competing submission has to wait on it
     */
    private static final class PausingDedupStore implements DedupStore<Accepted> {

        private final DedupStore<Accepted> delegate;
        private final CountDownLatch reserved;
        private final CountDownLatch resume;
        private final AtomicBoolean paused = new AtomicBoolean();

        PausingDedupStore(DedupStore<Accepted> delegate, CountDownLatch reserved, CountDownLatch resume) {
            this.delegate = delegate;
            this.reserved = reserved;
            this.resume = resume;
        }

        @Override
        public Optional<DedupRecord<Accepted>> putIfAbsent(DedupRecord<Accepted> candidate, Instant now, Runnable onReserved) {
            return delegate.putIfAbsent(candidate, now, () -> {
                if (paused.compareAndSet(false, true)) {
                    reserved.countDown();
                    try {
                        resume.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
                onReserved.run();
            });
        }

        @Override
        public Optional<DedupRecord<Accepted>> find(String idempotencyKey, Instant now) {
            return delegate.find(idempotencyKey, now);
        }

        @Override
        public List<DedupRecord<Accepted>> purgeExpired(Instant now, Consumer<DedupRecord<Accepted>> onReleased) {
            return delegate.purgeExpired(now, onReleased);
        }
    }

    private AdmissionCommand command(String transactionId, String idempotencyKey) {
        return new AdmissionCommand(transactionId, new BigDecimal("1000.00"), "USD", "EUR",
                "ACC-100", "ACC-200", "CP-1", idempotencyKey, "rtgs", "PAY");
    }
}
