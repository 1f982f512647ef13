package com.sbe.application.service.admission;

import com.sbe.application.port.in.TransactionAdmissionUseCase.AdmissionCommand;
import com.sbe.domain.model.SettlementDirection;
import com.sbe.domain.model.SettlementWindow;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Validates incoming submissions. Collects every problem rather than stopping at the first.
 */
public class TransactionValidator {

    // ISO 4217 codes accepted for settlement
    private static final Set<String> SUPPORTED_CURRENCIES = Set.of(
            "USD", "EUR", "GBP", "JPY", "CHF", "CAD", "AUD", "NZD", "CNY", "INR",
            "KRW", "SGD", "HKD", "MXN", "BRL", "ZAR", "SEK", "NOK", "DKK", "PLN"
    );

    private static final Pattern CURRENCY_CODE = Pattern.compile("^[A-Z]{3}$");
    private static final Pattern TRANSACTION_ID = Pattern.compile("^[A-Za-z0-9_-]+$");
    private static final BigDecimal MAX_AMOUNT = new BigDecimal("999999999.99");
    private static final int MAX_TRANSACTION_ID_LENGTH = 50;
    private static final int MAX_IDEMPOTENCY_KEY_LENGTH = 100;

    public ValidationResult validate(AdmissionCommand command) {
        List<String> errors = new ArrayList<>();

        validateRequiredFields(command, errors);
        validateAmount(command.amount(), errors);
        validateCurrency("sourceCurrency", command.sourceCurrency(), errors);
        validateCurrency("destinationCurrency", command.destinationCurrency(), errors);
        validateEnumValues(command, errors);
        validateBusinessRules(command, errors);

        return ValidationResult.of(errors);
    }

    private void validateRequiredFields(AdmissionCommand command, List<String> errors) {
        if (isBlank(command.transactionId())) {
            errors.add("transactionId is required");
        }
        if (command.amount() == null) {
            errors.add("amount is required");
        }
        if (isBlank(command.sourceCurrency())) {
            errors.add("sourceCurrency is required");
        }
        if (isBlank(command.destinationCurrency())) {
            errors.add("destinationCurrency is required");
        }
        if (isBlank(command.sourceAccount())) {
            errors.add("sourceAccount is required");
        }
        if (isBlank(command.destinationAccount())) {
            errors.add("destinationAccount is required");
        }
        if (isBlank(command.counterpartyId())) {
            errors.add("counterpartyId is required");
        }
        if (isBlank(command.idempotencyKey())) {
            errors.add("idempotencyKey is required");
        }
        if (isBlank(command.settlementWindow())) {
            errors.add("settlementWindow is required");
        }
    }

    private void validateAmount(BigDecimal amount, List<String> errors) {
        if (amount == null) {
            return;
        }
        if (amount.signum() <= 0) {
            errors.add("amount must be greater than 0");
        }
        if (amount.stripTrailingZeros().scale() > 2) {
            errors.add("amount must have at most 2 decimal places");
        }
        if (amount.compareTo(MAX_AMOUNT) > 0) {
            errors.add("amount exceeds maximum allowed value");
        }
    }

    private void validateCurrency(String field, String code, List<String> errors) {
        if (isBlank(code)) {
            return;
        }
        if (!CURRENCY_CODE.matcher(code).matches()) {
            errors.add(field + " must be a 3-letter upper-case ISO 4217 code");
        } else if (!SUPPORTED_CURRENCIES.contains(code)) {
            errors.add(field + " " + code + " is not supported");
        }
    }

    private void validateEnumValues(AdmissionCommand command, List<String> errors) {
        if (!isBlank(command.settlementWindow()) && !SettlementWindow.isValid(command.settlementWindow())) {
            errors.add("settlementWindow must be one of: rtgs, t0, t1, t2");
        }
        if (!isBlank(command.direction()) && !SettlementDirection.isValid(command.direction())) {
            errors.add("direction must be either PAY or RECEIVE");
        }
    }

    private void validateBusinessRules(AdmissionCommand command, List<String> errors) {
        String transactionId = command.transactionId();
        if (!isBlank(transactionId)) {
            if (transactionId.length() > MAX_TRANSACTION_ID_LENGTH) {
                errors.add("transactionId exceeds maximum length of " + MAX_TRANSACTION_ID_LENGTH + " characters");
            }
            if (!TRANSACTION_ID.matcher(transactionId).matches()) {
                errors.add("transactionId must be alphanumeric (dashes and underscores allowed)");
            }
        }

        if (command.idempotencyKey() != null && command.idempotencyKey().length() > MAX_IDEMPOTENCY_KEY_LENGTH) {
            errors.add("idempotencyKey exceeds maximum length of " + MAX_IDEMPOTENCY_KEY_LENGTH + " characters");
        }

        if (!isBlank(command.sourceAccount()) && command.sourceAccount().equals(command.destinationAccount())) {
            errors.add("sourceAccount and destinationAccount must differ");
        }
    }

    private boolean isBlank(String str) {
        return str == null || str.trim().isEmpty();
    }
}
