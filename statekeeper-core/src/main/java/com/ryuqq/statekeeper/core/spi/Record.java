package com.ryuqq.statekeeper.core.spi;

/**
 * Record SPI: the entity whose state field is managed.
 *
 * <p>Records are created and destroyed by the surrounding document mapper. The coordinator
 * never owns a Record; it receives a handle per call and mutates the state field through
 * {@link #set(String, Object)}.</p>
 *
 * <p><strong>Raw Values:</strong></p>
 * <ul>
 *   <li>Values are returned exactly as stored (may be null for unset fields)</li>
 *   <li>{@link #set(String, Object)} must accept null to clear a field</li>
 *   <li>A value written with {@code set} must be returned unchanged by the next {@code get}</li>
 * </ul>
 *
 * <p><strong>Thread Safety:</strong> Not required. Concurrent use of the same Record
 * must be serialized by the caller.</p>
 *
 * @author Statekeeper Team
 * @since 1.0.0
 */
public interface Record {

    /**
     * Returns the identity used by a {@link Store} to locate this record.
     *
     * @return the record identifier (never null)
     */
    String id();

    /**
     * Reads the raw in-memory value of a field.
     *
     * @param fieldName the field name
     * @return the raw value, or null if the field is unset
     * @throws IllegalArgumentException if fieldName is null
     */
    Object get(String fieldName);

    /**
     * Writes the raw in-memory value of a field without persisting it.
     *
     * @param fieldName the field name
     * @param rawValue the raw value (null clears the field)
     * @throws IllegalArgumentException if fieldName is null
     */
    void set(String fieldName, Object rawValue);
}
