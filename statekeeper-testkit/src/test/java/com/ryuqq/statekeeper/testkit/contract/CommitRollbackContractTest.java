package com.ryuqq.statekeeper.testkit.contract;

import com.ryuqq.statekeeper.core.model.State;
import com.ryuqq.statekeeper.core.outcome.Committed;
import com.ryuqq.statekeeper.core.outcome.RolledBack;
import com.ryuqq.statekeeper.core.outcome.WriteOutcome;
import com.ryuqq.statekeeper.core.spi.Record;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for durable writes: commit and rollback.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Store accepts → Committed, field holds the target state</li>
 *   <li>Store rejects → RolledBack(previous), field holds the exact previous raw value</li>
 *   <li>Rejection by exception behaves like a false return</li>
 *   <li>Exactly one store operation per durable write</li>
 * </ul>
 *
 * @author Statekeeper Team
 * @since 1.0.0
 */
class CommitRollbackContractTest extends AbstractContractTest {

    @ParameterizedTest
    @NullSource
    @ValueSource(strings = {"", "pending", "0"})
    void testCommit_WhenStoreAccepts_FieldHoldsTarget(String initial) {
        // Given
        Record record = createRecord(initial);

        // When
        WriteOutcome outcome = coordinator.writeDurable(record, State.of("opened"), acceptingStore());

        // Then
        assertEquals(Committed.of(State.of("opened")), outcome);
        assertRawState(record, "opened");
        assertPersistCount(1);
    }

    @ParameterizedTest
    @NullSource
    @ValueSource(strings = {"", "pending", "0"})
    void testRollback_WhenStoreRejects_FieldHoldsExactPreviousValue(String initial) {
        // Given
        Record record = createRecord(initial);

        // When
        WriteOutcome outcome = coordinator.writeDurable(record, State.of("opened"), rejectingStore());

        // Then
        assertEquals(new RolledBack(initial, State.of("opened")), outcome);
        assertRawState(record, initial);
        assertPersistCount(1);
    }

    @Test
    void testRollback_WhenStoreRejectsByException_TreatedAsRejection() {
        // Given
        Record record = createRecord("opened");
        store.then(ScriptedStore.Response.REJECT_BY_EXCEPTION);

        // When
        WriteOutcome outcome = coordinator.writeDurable(record, State.of("closed"), store);

        // Then
        assertTrue(outcome.isRolledBack());
        assertRawState(record, "opened");
    }

    @Test
    void testPersist_SeesTargetStateAndSkipsValidation() {
        // Given
        Record record = createRecord("pending");

        // When
        coordinator.writeDurable(record, State.of("opened"), store);

        // Then
        ScriptedStore.PersistCall call = store.calls().get(0);
        assertEquals(record.id(), call.recordId());
        assertEquals("opened", call.fieldValue(), "Store must observe the target state");
        assertFalse(call.options().validate(), "Durable writes must bypass validation");
    }

    @Test
    void testEachDurableWrite_PerformsExactlyOneStoreOperation() {
        // Given
        Record record = createRecord("pending");
        store.then(ScriptedStore.Response.ACCEPT, ScriptedStore.Response.REJECT, ScriptedStore.Response.ACCEPT);

        // When
        coordinator.writeDurable(record, State.of("opened"), store);
        coordinator.writeDurable(record, State.of("closed"), store);
        coordinator.writeDurable(record, State.of("archived"), store);

        // Then
        assertPersistCount(3);
        assertRawState(record, "archived");
    }
}
