package com.sbe.application.service.admission;

import com.sbe.application.port.in.AdmissionOutcome;
import com.sbe.application.port.in.AdmissionOutcome.Accepted;
import com.sbe.application.port.in.AdmissionOutcome.Duplicate;
import com.sbe.application.port.in.AdmissionOutcome.Rejected;
import com.sbe.application.port.in.TransactionAdmissionUseCase;
import com.sbe.application.port.out.DedupStore;
import com.sbe.application.port.out.IntentDispatcher;
import com.sbe.application.port.out.TransactionStatusRepository;
import com.sbe.application.service.ledger.LedgerEmitter;
import com.sbe.domain.event.LedgerEventType;
import com.sbe.domain.model.DedupRecord;
import com.sbe.domain.model.SettlementDirection;
import com.sbe.domain.model.SettlementWindow;
import com.sbe.domain.model.TransactionIntent;
import com.sbe.domain.model.TransactionState;
import com.sbe.domain.model.TransactionStatus;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Admission use case: validate, deduplicate by idempotency key, apply intake back-pressure,
 * then hand the intent to the batching side.
 *
 * The check-and-set on the key and the transaction id is a single atomic store operation, so
 * concurrent submissions of one key produce exactly one Accepted and every caller sees the same
 * payload. A transaction id already admitted under another key is rejected.
 */
@Slf4j
public class IdempotencyGate implements TransactionAdmissionUseCase {

    private final TransactionValidator validator;
    private final DedupStore<Accepted> dedupStore;
    private final IntakeCapacity capacity;
    private final LedgerEmitter ledgerEmitter;
    private final TransactionStatusRepository statusRepository;
    private final IntentDispatcher dispatcher;
    private final Clock clock;
    private final Duration retention;

    public IdempotencyGate(
            TransactionValidator validator,
            DedupStore<Accepted> dedupStore,
            IntakeCapacity capacity,
            LedgerEmitter ledgerEmitter,
            TransactionStatusRepository statusRepository,
            IntentDispatcher dispatcher,
            Clock clock,
            Duration retention
    ) {
        this.validator = validator;
        this.dedupStore = dedupStore;
        this.capacity = capacity;
        this.ledgerEmitter = ledgerEmitter;
        this.statusRepository = statusRepository;
        this.dispatcher = dispatcher;
        this.clock = clock;
        this.retention = retention;
    }

    @Override
    public AdmissionOutcome admit(AdmissionCommand command) {
        ValidationResult validation = validator.validate(command);
        if (!validation.isValid()) {
            log.warn("Validation failed for transaction {}: {}", command.transactionId(), validation.errors());
            return Rejected.invalid(validation.errors());
        }

        Instant now = clock.instant();

        if (!capacity.tryAcquire()) {
            // a replay of an admitted key is still answered while the intake is saturated
            Optional<DedupRecord<Accepted>> existing = dedupStore.find(command.idempotencyKey(), now);
            if (existing.isPresent()) {
                return duplicateOf(existing.get());
            }
            log.warn("Intake saturated ({} in flight), rejecting {}", capacity.inFlight(), command.transactionId());
            return Rejected.saturated("intake backlog is full, retry later");
        }

        Accepted accepted = new Accepted(toIntent(command, now));
        TransactionIntent intent = accepted.intent();
        DedupRecord<Accepted> candidate = new DedupRecord<>(command.idempotencyKey(), command.transactionId(),
                accepted, now, now.plus(retention));

        // SUBMITTED is emitted before the record is visible, so no replay can be sequenced ahead of it
        Optional<DedupRecord<Accepted>> prior = dedupStore.putIfAbsent(candidate, now, () -> recordSubmitted(intent, now));
        if (prior.isPresent()) {
            capacity.release(1);
            if (!prior.get().getIdempotencyKey().equals(command.idempotencyKey())) {
                log.warn("Transaction {} already admitted under key {}, rejecting key {}", command.transactionId(),
                        prior.get().getIdempotencyKey(), command.idempotencyKey());
                return Rejected.invalid(List.of("transactionId " + command.transactionId()
                        + " was already submitted with a different idempotency key"));
            }
            return duplicateOf(prior.get());
        }

        dispatcher.dispatch(intent);

        log.info("Transaction {} accepted into {}:{}", intent.getTransactionId(),
                intent.getWindow().getValue(), intent.getCurrencyPair());
        return accepted;
    }

    private void recordSubmitted(TransactionIntent intent, Instant now) {
        ledgerEmitter.emit(LedgerEventType.SUBMITTED, intent.getTransactionId(), Map.of(
                "idempotencyKey", intent.getIdempotencyKey(),
                "amount", intent.getAmount().toPlainString(),
                "pair", intent.getCurrencyPair().toString(),
                "window", intent.getWindow().getValue(),
                "counterpartyId", intent.getCounterpartyId()
        ));
        statusRepository.save(new TransactionState(intent.getTransactionId(), TransactionStatus.SUBMITTED, null, now));
    }

    private Duplicate duplicateOf(DedupRecord<Accepted> record) {
        Accepted prior = record.getOutcome();
        log.info("Duplicate submission for key {} (transaction {})", record.getIdempotencyKey(), prior.transactionId());
        ledgerEmitter.emit(LedgerEventType.DEDUPED, prior.transactionId(),
                Map.of("idempotencyKey", record.getIdempotencyKey()));
        return new Duplicate(prior);
    }

    private TransactionIntent toIntent(AdmissionCommand command, Instant now) {
        return TransactionIntent.builder()
                .transactionId(command.transactionId())
                .amount(command.amount())
                .sourceCurrency(command.sourceCurrency())
                .destinationCurrency(command.destinationCurrency())
                .sourceAccount(command.sourceAccount())
                .destinationAccount(command.destinationAccount())
                .counterpartyId(command.counterpartyId())
                .window(SettlementWindow.fromValue(command.settlementWindow()))
                .direction(command.direction() == null || command.direction().isBlank()
                        ? SettlementDirection.PAY
                        : SettlementDirection.fromValue(command.direction()))
                .idempotencyKey(command.idempotencyKey())
                .submittedAt(now)
                .build();
    }
}
