package com.ryuqq.statekeeper.core.spi;

/**
 * A record's own validation rules.
 *
 * <p>Rule definition belongs to the host application. The lifecycle pipeline runs the
 * initial-state hook before every call to {@link #validate(Record)}.</p>
 *
 * @author Statekeeper Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Validator {

    /**
     * Validator that accepts every record.
     */
    Validator NONE = record -> ValidationResult.valid();

    /**
     * Runs the validation rules.
     *
     * @param record the record to validate
     * @return the validation result
     */
    ValidationResult validate(Record record);
}
