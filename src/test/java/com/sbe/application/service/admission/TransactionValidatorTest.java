package com.sbe.application.service.admission;

import com.sbe.application.port.in.TransactionAdmissionUseCase.AdmissionCommand;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TransactionValidator
 */
class TransactionValidatorTest {

    private TransactionValidator validator;

    @BeforeEach
    void setUp() {
        validator = new TransactionValidator();
    }

    @Test
    void testValidSubmission() {
        ValidationResult result = validator.validate(command("TX-1001", new BigDecimal("2500.00"), "USD", "EUR", "rtgs", "PAY"));

        assertTrue(result.isValid(), "Valid submission should pass validation");
        assertTrue(result.errors().isEmpty());
    }

    @Test
    void testDirectionIsOptional() {
        assertTrue(validator.validate(command("TX-1001", new BigDecimal("1.00"), "USD", "EUR", "t1", null)).isValid());
    }

    @Test
    void testMissingRequiredFields() {
        AdmissionCommand command = new AdmissionCommand(null, null, null, null, null, null, null, null, null, null);

        ValidationResult result = validator.validate(command);

        assertFalse(result.isValid());
        assertTrue(result.errors().contains("transactionId is required"));
        assertTrue(result.errors().contains("amount is required"));
        assertTrue(result.errors().contains("idempotencyKey is required"));
        assertTrue(result.errors().contains("settlementWindow is required"));
        assertEquals(9, result.errors().size());
    }

    @Test
    void testAmountRules() {
        assertTrue(validator.validate(command("TX-1", BigDecimal.ZERO, "USD", "EUR", "rtgs", null))
                .errors().contains("amount must be greater than 0"));
        assertTrue(validator.validate(command("TX-1", new BigDecimal("-5.00"), "USD", "EUR", "rtgs", null))
                .errors().contains("amount must be greater than 0"));
        assertTrue(validator.validate(command("TX-1", new BigDecimal("1.001"), "USD", "EUR", "rtgs", null))
                .errors().contains("amount must have at most 2 decimal places"));
        assertTrue(validator.validate(command("TX-1", new BigDecimal("1000000000.00"), "USD", "EUR", "rtgs", null))
                .errors().contains("amount exceeds maximum allowed value"));

        // Trailing zeros do not count as decimal places
        assertTrue(validator.validate(command("TX-1", new BigDecimal("1.5000"), "USD", "EUR", "rtgs", null)).isValid());
        assertTrue(validator.validate(command("TX-1", new BigDecimal("999999999.99"), "USD", "EUR", "rtgs", null)).isValid());
    }

    @Test
    void testCurrencyRules() {
        ValidationResult lowerCase = validator.validate(command("TX-1", BigDecimal.ONE, "usd", "EUR", "rtgs", null));
        assertTrue(lowerCase.errors().contains("sourceCurrency must be a 3-letter upper-case ISO 4217 code"));

        ValidationResult unsupported = validator.validate(command("TX-1", BigDecimal.ONE, "USD", "XAU", "rtgs", null));
        assertTrue(unsupported.errors().contains("destinationCurrency XAU is not supported"));
    }

    @Test
    void testEnumValues() {
        ValidationResult result = validator.validate(command("TX-1", BigDecimal.ONE, "USD", "EUR", "weekly", "LEND"));

        assertTrue(result.errors().contains("settlementWindow must be one of: rtgs, t0, t1, t2"));
        assertTrue(result.errors().contains("direction must be either PAY or RECEIVE"));
    }

    @Test
    void testTransactionIdRules() {
        assertTrue(validator.validate(command("TX 1", BigDecimal.ONE, "USD", "EUR", "rtgs", null))
                .errors().contains("transactionId must be alphanumeric (dashes and underscores allowed)"));
        assertTrue(validator.validate(command("X".repeat(51), BigDecimal.ONE, "USD", "EUR", "rtgs", null))
                .errors().contains("transactionId exceeds maximum length of 50 characters"));
        assertTrue(validator.validate(command("tx_1-a", BigDecimal.ONE, "USD", "EUR", "rtgs", null)).isValid());
    }

    @Test
    void testSameAccountsRejected() {
        AdmissionCommand command = new AdmissionCommand("TX-1", BigDecimal.ONE, "USD", "EUR",
                "ACC-1", "ACC-1", "CP-1", "K-1", "rtgs", null);

        assertTrue(validator.validate(command).errors().contains("sourceAccount and destinationAccount must differ"));
    }

    @Test
    void testIdempotencyKeyLength() {
        AdmissionCommand command = new AdmissionCommand("TX-1", BigDecimal.ONE, "USD", "EUR",
                "ACC-1", "ACC-2", "CP-1", "K".repeat(101), "rtgs", null);

        assertTrue(validator.validate(command).errors()
                .contains("idempotencyKey exceeds maximum length of 100 characters"));
    }

    private AdmissionCommand command(String id, BigDecimal amount, String source, String destination,
                                     String window, String direction) {
        return new AdmissionCommand(id, amount, source, destination, "ACC-SRC", "ACC-DST", "CP-1",
                "key-" + id, window, direction);
    }
}
