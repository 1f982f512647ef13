package com.sbe.application.port.in;

import com.sbe.domain.model.TransactionIntent;

import java.util.List;

/**
 * Result of submitting a transaction. Callers must handle every variant.
 */
public interface AdmissionOutcome {

    String STATUS_SUBMITTED = "submitted";

    /**
     * First admission of an idempotency key
     */
    record Accepted(TransactionIntent intent) implements AdmissionOutcome {
        public String transactionId() {
            return intent.getTransactionId();
        }

        public String status() {
            return STATUS_SUBMITTED;
        }
    }

    /**
     * Replay of a key that was already admitted; carries the original outcome unchanged
     */
    record Duplicate(Accepted prior) implements AdmissionOutcome {
    }

    /**
     * Validation failure, or intake saturation when {@code retryable} is set
     */
    record Rejected(List<String> errors, boolean retryable) implements AdmissionOutcome {
        public Rejected {
            errors = List.copyOf(errors);
        }

        public static Rejected invalid(List<String> errors) {
            return new Rejected(errors, false);
        }

        public static Rejected saturated(String reason) {
            return new Rejected(List.of(reason), true);
        }
    }
}
