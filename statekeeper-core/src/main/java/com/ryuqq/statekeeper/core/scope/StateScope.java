package com.ryuqq.statekeeper.core.scope;

import com.ryuqq.statekeeper.core.model.State;
import com.ryuqq.statekeeper.core.model.StateField;
import com.ryuqq.statekeeper.core.spi.Record;

/**
 * Query entry point selecting records in one declared state.
 *
 * <p>A scope is the criterion {@code { field: state }}. Document stores translate it into
 * their native query; in-memory stores can evaluate it with {@link #matches(Record)}.</p>
 *
 * @param name the scope name (the state label)
 * @param field the state field
 * @param state the selected state
 *
 * @author Statekeeper Team
 * @since 1.0.0
 */
public record StateScope(String name, StateField field, State state) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException if any component is null, or name/state is blank
     */
    public StateScope {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (field == null) {
            throw new IllegalArgumentException("field cannot be null");
        }
        if (state == null || state.isBlank()) {
            throw new IllegalArgumentException("state cannot be null or blank");
        }
    }

    /**
     * Checks whether a record's in-memory state equals this scope's state.
     *
     * @param record the record to test
     * @return true if the record's state field holds this scope's state
     */
    public boolean matches(Record record) {
        if (record == null) {
            return false;
        }
        return state.equals(State.of(record.get(field.getName())));
    }
}
