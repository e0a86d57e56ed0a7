package com.ryuqq.statekeeper.core.spi;

/**
 * Signals that a {@link Store} refused to save a record.
 *
 * <p>Stores that cannot report a rejection as a {@code false} return value (for example
 * when a unique constraint fails inside a driver call) may throw this exception instead.
 * A durable state write recovers from it by rolling the state field back.</p>
 *
 * @author Statekeeper Team
 * @since 1.0.0
 */
public class PersistenceRejectedException extends RuntimeException {

    private final String recordId;

    /**
     * Creates a rejection for the given record.
     *
     * @param recordId the rejected record id
     * @param message the rejection reason
     */
    public PersistenceRejectedException(String recordId, String message) {
        super(message);
        this.recordId = recordId;
    }

    /**
     * Creates a rejection for the given record with an underlying cause.
     *
     * @param recordId the rejected record id
     * @param message the rejection reason
     * @param cause the underlying cause
     */
    public PersistenceRejectedException(String recordId, String message, Throwable cause) {
        super(message, cause);
        this.recordId = recordId;
    }

    /**
     * Returns the rejected record id.
     *
     * @return the record id (may be null)
     */
    public String getRecordId() {
        return recordId;
    }
}
