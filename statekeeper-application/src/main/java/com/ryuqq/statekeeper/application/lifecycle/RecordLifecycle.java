package com.ryuqq.statekeeper.application.lifecycle;

import com.ryuqq.statekeeper.application.coordinator.StateCoordinator;
import com.ryuqq.statekeeper.core.spi.InitialStateSupplier;
import com.ryuqq.statekeeper.core.spi.PersistOptions;
import com.ryuqq.statekeeper.core.spi.PersistenceRejectedException;
import com.ryuqq.statekeeper.core.spi.Record;
import com.ryuqq.statekeeper.core.spi.Store;
import com.ryuqq.statekeeper.core.spi.ValidationResult;
import com.ryuqq.statekeeper.core.spi.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Record validate/save pipeline with an explicit pre-validation hook.
 *
 * <p>The initial-state hook is an explicit step of this pipeline rather than a callback
 * discovered by convention. It runs once per validation attempt, before the validation
 * rules, and re-checks blankness every time.</p>
 *
 * <p><strong>Pipeline:</strong></p>
 * <pre>
 * validate(record):
 *   1. coordinator.ensureInitialState(record, initialStateSupplier)
 *   2. validator.validate(record)
 *
 * save(record):
 *   1. validate(record) → invalid: return false (nothing persisted)
 *   2. store.persist(record, validate=false)   (rules already ran in step 1)
 *      → PersistenceRejectedException: return false
 * </pre>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * RecordLifecycle lifecycle = new RecordLifecycle(coordinator,
 *     InitialStateSupplier.fixed(State.of("pending")), orderValidator, store);
 *
 * Order order = new Order();      // state unset
 * lifecycle.save(order);          // state = "pending", then persisted
 * </pre>
 *
 * @author Statekeeper Team
 * @since 1.0.0
 */
public class RecordLifecycle {

    private static final Logger log = LoggerFactory.getLogger(RecordLifecycle.class);

    private final StateCoordinator coordinator;
    private final InitialStateSupplier initialStateSupplier;
    private final Validator validator;
    private final Store store;

    /**
     * Creates a lifecycle pipeline.
     *
     * @param coordinator the state coordinator
     * @param initialStateSupplier the FSM initial state supplier
     * @param validator the record's validation rules
     * @param store the store used by {@link #save(Record)}
     * @throws IllegalArgumentException if any argument is null
     */
    public RecordLifecycle(StateCoordinator coordinator,
                           InitialStateSupplier initialStateSupplier,
                           Validator validator,
                           Store store) {
        if (coordinator == null) {
            throw new IllegalArgumentException("coordinator cannot be null");
        }
        if (initialStateSupplier == null) {
            throw new IllegalArgumentException("initialStateSupplier cannot be null");
        }
        if (validator == null) {
            throw new IllegalArgumentException("validator cannot be null");
        }
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        this.coordinator = coordinator;
        this.initialStateSupplier = initialStateSupplier;
        this.validator = validator;
        this.store = store;
    }

    /**
     * Runs the pre-validation hook and then the validation rules.
     *
     * @param record the record to validate
     * @return the validation result
     * @throws IllegalArgumentException if record is null
     */
    public ValidationResult validate(Record record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        coordinator.ensureInitialState(record, initialStateSupplier);
        return validator.validate(record);
    }

    /**
     * Validates and, when valid, persists the record.
     *
     * <p>A {@link PersistenceRejectedException} from the store is reported as {@code false};
     * any other exception propagates.</p>
     *
     * @param record the record to save
     * @return true if the record was valid and the store accepted it
     * @throws IllegalArgumentException if record is null
     */
    public boolean save(Record record) {
        ValidationResult result = validate(record);
        if (!result.isValid()) {
            log.debug("Record {} not saved, validation failed: {}", record.id(), result.errors());
            return false;
        }
        try {
            return store.persist(record, PersistOptions.skipValidation());
        } catch (PersistenceRejectedException e) {
            log.debug("Record {} not saved, store rejected: {}", record.id(), e.getMessage());
            return false;
        }
    }

    /**
     * Returns the coordinator used by this pipeline.
     *
     * @return the state coordinator
     */
    public StateCoordinator getCoordinator() {
        return coordinator;
    }
}
