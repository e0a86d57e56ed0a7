package com.ryuqq.statekeeper.core.spi;

import java.util.List;

/**
 * Result of running a record's validation rules.
 *
 * @param errors validation error messages (empty when valid)
 *
 * @author Statekeeper Team
 * @since 1.0.0
 */
public record ValidationResult(List<String> errors) {

    private static final ValidationResult VALID = new ValidationResult(List.of());

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException if errors is null
     */
    public ValidationResult {
        if (errors == null) {
            throw new IllegalArgumentException("errors cannot be null");
        }
        errors = List.copyOf(errors);
    }

    /**
     * Returns a result without errors.
     *
     * @return a valid result
     */
    public static ValidationResult valid() {
        return VALID;
    }

    /**
     * Returns a result with the given errors.
     *
     * @param errors error messages
     * @return a result (valid if no messages are given)
     */
    public static ValidationResult of(String... errors) {
        return new ValidationResult(List.of(errors));
    }

    /**
     * Checks whether validation passed.
     *
     * @return true if there are no errors
     */
    public boolean isValid() {
        return errors.isEmpty();
    }
}
