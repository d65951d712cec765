package com.beacon.statusmodel;

import java.util.List;

/**
 * Result of validating a {@link StatusSubmission}.
 *
 * @param valid true if validation passed with no errors
 * @param errors human-readable error messages (empty when valid)
 */
public record ValidationResult(boolean valid, List<String> errors) {

    public ValidationResult {
        errors = List.copyOf(errors);
    }

    public static ValidationResult ok() {
        return new ValidationResult(true, List.of());
    }

    public static ValidationResult fail(List<String> errors) {
        return new ValidationResult(false, errors);
    }

    /** All errors joined into one line, or an empty string when valid. */
    public String message() {
        return String.join("; ", errors);
    }
}
