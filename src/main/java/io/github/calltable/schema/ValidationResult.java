package io.github.calltable.schema;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcome of validating one raw record. Valid exactly when no errors were collected.
 */
public final class ValidationResult {

    private static final ValidationResult VALID = new ValidationResult(List.of());

    private final List<ValidationError> errors;

    private ValidationResult(List<ValidationError> errors) {
        this.errors = List.copyOf(errors);
    }

    public static ValidationResult valid() {
        return VALID;
    }

    public static ValidationResult of(List<ValidationError> errors) {
        return errors.isEmpty() ? VALID : new ValidationResult(errors);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    /**
     * Returns the errors in the order they were found.
     */
    public List<ValidationError> getErrors() {
        return errors;
    }

    /**
     * Returns true if any error is of the given kind.
     */
    public boolean hasError(ValidationError.Kind kind) {
        return errors.stream().anyMatch(e -> e.kind() == kind);
    }

    /**
     * Formats all errors into a single string.
     */
    public String formatErrors() {
        return errors.stream()
                .map(ValidationError::message)
                .collect(Collectors.joining("; "));
    }

    @Override
    public String toString() {
        return isValid() ? "ValidationResult[valid]" : "ValidationResult[" + formatErrors() + "]";
    }
}
