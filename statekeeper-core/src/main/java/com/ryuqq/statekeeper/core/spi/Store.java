package com.ryuqq.statekeeper.core.spi;

/**
 * Durable storage SPI for records.
 *
 * <p>This interface is the only I/O the coordinator performs. A durable state write
 * calls {@link #persist(Record, PersistOptions)} exactly once.</p>
 *
 * <p><strong>Failure Contract:</strong></p>
 * <ul>
 *   <li>Ordinary validation or constraint failures: return {@code false}</li>
 *   <li>Alternatively a store may throw {@link PersistenceRejectedException}; it is treated
 *       exactly like {@code false}</li>
 *   <li>Infrastructure faults (connectivity loss, serialization errors): throw any other
 *       runtime exception; the coordinator does not swallow it</li>
 * </ul>
 *
 * <p><strong>Durable Write Sequence:</strong></p>
 * <pre>
 * 1. previous = record.get(field)
 * 2. record.set(field, target)
 * 3. store.persist(record, PersistOptions.skipValidation())
 *    → true : Committed
 *    → false: record.set(field, previous), RolledBack(previous)
 * </pre>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>{@code validate=false} must bypass the record's own validation rules</li>
 *   <li>No retry is expected from callers; retry policy, if any, belongs to the store</li>
 *   <li>Concurrent-safe for different records</li>
 * </ul>
 *
 * @author Statekeeper Team
 * @since 1.0.0
 */
public interface Store {

    /**
     * Saves the record.
     *
     * @param record the record to save
     * @param options persist options
     * @return true if the save succeeded, false if the store rejected it
     * @throws IllegalArgumentException if record or options is null
     * @throws PersistenceRejectedException optionally, instead of returning false
     */
    boolean persist(Record record, PersistOptions options);
}
