package com.ryuqq.statekeeper.core.spi;

/**
 * Options passed to {@link Store#persist(Record, PersistOptions)}.
 *
 * @param validate whether the record's own validation rules run before saving
 *
 * @author Statekeeper Team
 * @since 1.0.0
 */
public record PersistOptions(boolean validate) {

    private static final PersistOptions SKIP_VALIDATION = new PersistOptions(false);
    private static final PersistOptions VALIDATING = new PersistOptions(true);

    /**
     * Options that bypass the record's validation rules.
     *
     * <p>Used for state writes: the transition was already authorized by the FSM guards.</p>
     *
     * @return options with {@code validate=false}
     */
    public static PersistOptions skipValidation() {
        return SKIP_VALIDATION;
    }

    /**
     * Options that run the record's validation rules before saving.
     *
     * @return options with {@code validate=true}
     */
    public static PersistOptions validating() {
        return VALIDATING;
    }
}
