package com.sbe.application.service.admission;

import java.util.List;

/**
 * Outcome of validating a submission; empty error list means valid
 */
public record ValidationResult(List<String> errors) {

    public ValidationResult {
        errors = List.copyOf(errors);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public static ValidationResult of(List<String> errors) {
        return new ValidationResult(errors);
    }
}
