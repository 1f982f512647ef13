package com.sbe.adapter.in.web.submission;

import com.sbe.adapter.in.web.ErrorResponse;
import com.sbe.application.port.in.AdmissionOutcome;
import com.sbe.application.port.in.AdmissionOutcome.Accepted;
import com.sbe.application.port.in.AdmissionOutcome.Duplicate;
import com.sbe.application.port.in.AdmissionOutcome.Rejected;
import com.sbe.application.port.in.TransactionAdmissionUseCase;
import com.sbe.application.port.in.TransactionAdmissionUseCase.AdmissionCommand;
import io.vertx.core.Handler;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * HTTP handler for transaction submission
 * Handles POST /api/transactions
 */
@Slf4j
@RequiredArgsConstructor
public class TransactionSubmissionHandler implements Handler<RoutingContext> {

    static final String REPLAYED_HEADER = "Idempotent-Replayed";
    static final String RETRY_AFTER_SECONDS = "1";

    private final TransactionAdmissionUseCase admissionUseCase;

    @Override
    public void handle(RoutingContext context) {
        TransactionSubmissionRequest request;
        try {
            request = context.body().asPojo(TransactionSubmissionRequest.class);
        } catch (DecodeException | IllegalArgumentException e) {
            log.warn("Unreadable submission body: {}", e.getMessage());
            ErrorResponse.send(context, 400, ErrorResponse.of("Invalid request format: " + e.getMessage()));
            return;
        }
        if (request == null) {
            ErrorResponse.send(context, 400, ErrorResponse.of("Request body is required"));
            return;
        }

        log.debug("Received submission {} (key {})", request.transactionId(), request.idempotencyKey());

        AdmissionCommand command = new AdmissionCommand(
                request.transactionId(),
                request.amount(),
                request.sourceCurrency(),
                request.destinationCurrency(),
                request.sourceAccount(),
                request.destinationAccount(),
                request.counterpartyId(),
                request.idempotencyKey(),
                request.settlementWindow(),
                request.direction()
        );

        AdmissionOutcome outcome;
        try {
            outcome = admissionUseCase.admit(command);
        } catch (Exception e) {
            log.error("Failed to admit transaction {}", request.transactionId(), e);
            ErrorResponse.send(context, 500, ErrorResponse.of("Internal error: " + e.getMessage()));
            return;
        }

        if (outcome instanceof Accepted) {
            sendSubmitted(context, 201, (Accepted) outcome);
        } else if (outcome instanceof Duplicate) {
            context.response().putHeader(REPLAYED_HEADER, "true");
            sendSubmitted(context, 200, ((Duplicate) outcome).prior());
        } else {
            Rejected rejected = (Rejected) outcome;
            if (rejected.retryable()) {
                context.response().putHeader("Retry-After", RETRY_AFTER_SECONDS);
                ErrorResponse.send(context, 429, ErrorResponse.of("Service busy", rejected.errors()));
            } else {
                ErrorResponse.send(context, 400, ErrorResponse.of("Validation failed", rejected.errors()));
            }
        }
    }

    private void sendSubmitted(RoutingContext context, int statusCode, Accepted accepted) {
        context.response()
                .setStatusCode(statusCode)
                .putHeader("Content-Type", "application/json")
                .end(JsonObject.mapFrom(TransactionSubmissionResponse.from(accepted)).encode());
    }
}
