package com.ryuqq.statekeeper.core.spi;

import com.ryuqq.statekeeper.core.model.State;

/**
 * Computes the designated initial state for a record.
 *
 * <p>Provided by the FSM configuration. The result may depend on record data
 * (conditional initial states) but must be deterministic for a given record snapshot.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InitialStateSupplier fixed = InitialStateSupplier.fixed(State.of("pending"));
 * InitialStateSupplier conditional = record -&gt;
 *     "vip".equals(record.get("tier")) ? State.of("approved") : State.of("pending");
 * </pre>
 *
 * @author Statekeeper Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface InitialStateSupplier {

    /**
     * Computes the initial state.
     *
     * @param record the record being initialized
     * @return the initial state; {@link State#BLANK} or null is a configuration defect
     */
    State compute(Record record);

    /**
     * Supplier that always returns the same state.
     *
     * @param state the initial state
     * @return a constant supplier
     * @throws IllegalArgumentException if state is null
     */
    static InitialStateSupplier fixed(State state) {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        return record -> state;
    }
}
