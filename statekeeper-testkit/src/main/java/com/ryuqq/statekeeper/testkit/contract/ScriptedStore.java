package com.ryuqq.statekeeper.testkit.contract;

import com.ryuqq.statekeeper.core.spi.PersistOptions;
import com.ryuqq.statekeeper.core.spi.PersistenceRejectedException;
import com.ryuqq.statekeeper.core.spi.Record;
import com.ryuqq.statekeeper.core.spi.Store;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link Store} whose responses are scripted by the test.
 *
 * <p>Each {@code persist} call consumes the next scripted {@link Response}; when the script
 * is exhausted the default response is used. Every call is recorded for assertions.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * ScriptedStore store = ScriptedStore.accepting()
 *     .then(Response.REJECT);            // first call rejects, later calls accept
 *
 * coordinator.writeDurable(record, State.of("closed"), store); // RolledBack
 * assertEquals(1, store.persistCount());
 * </pre>
 *
 * @author Statekeeper Team
 * @since 1.0.0
 */
public class ScriptedStore implements Store {

    /**
     * Scripted persist response.
     */
    public enum Response {
        /** Return true. */
        ACCEPT,
        /** Return false. */
        REJECT,
        /** Throw {@link PersistenceRejectedException}. */
        REJECT_BY_EXCEPTION,
        /** Throw {@link StoreFaultException} (collaborator fault). */
        FAULT
    }

    /**
     * A recorded persist call.
     *
     * @param recordId the persisted record id
     * @param options the options passed by the caller
     * @param fieldValue value of the observed field at persist time (null if none observed)
     */
    public record PersistCall(String recordId, PersistOptions options, Object fieldValue) {
    }

    private final Deque<Response> script = new ArrayDeque<>();
    private final List<PersistCall> calls = new CopyOnWriteArrayList<>();
    private volatile Response defaultResponse;
    private volatile String observedField;

    /**
     * Creates a store with the given default response.
     *
     * @param defaultResponse response used when the script is empty
     * @throws IllegalArgumentException if defaultResponse is null
     */
    public ScriptedStore(Response defaultResponse) {
        if (defaultResponse == null) {
            throw new IllegalArgumentException("defaultResponse cannot be null");
        }
        this.defaultResponse = defaultResponse;
    }

    /**
     * Store that accepts every save.
     *
     * @return a new store
     */
    public static ScriptedStore accepting() {
        return new ScriptedStore(Response.ACCEPT);
    }

    /**
     * Store that rejects every save by returning false.
     *
     * @return a new store
     */
    public static ScriptedStore rejecting() {
        return new ScriptedStore(Response.REJECT);
    }

    /**
     * Appends responses to the script.
     *
     * @param responses responses consumed in order by the next persist calls
     * @return this
     */
    public synchronized ScriptedStore then(Response... responses) {
        for (Response response : responses) {
            if (response == null) {
                throw new IllegalArgumentException("response cannot be null");
            }
            script.addLast(response);
        }
        return this;
    }

    /**
     * Changes the default response.
     *
     * @param response the new default response
     * @return this
     */
    public ScriptedStore respondWith(Response response) {
        if (response == null) {
            throw new IllegalArgumentException("response cannot be null");
        }
        this.defaultResponse = response;
        return this;
    }

    /**
     * Records the value of a field at each persist call.
     *
     * @param fieldName the field to observe
     * @return this
     */
    public ScriptedStore observing(String fieldName) {
        this.observedField = fieldName;
        return this;
    }

    @Override
    public boolean persist(Record record, PersistOptions options) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }

        String field = observedField;
        calls.add(new PersistCall(record.id(), options, field != null ? record.get(field) : null));

        Response response = nextResponse();
        switch (response) {
            case ACCEPT:
                return true;
            case REJECT:
                return false;
            case REJECT_BY_EXCEPTION:
                throw new PersistenceRejectedException(record.id(), "Scripted rejection");
            case FAULT:
                throw new StoreFaultException("Scripted store fault for record " + record.id());
            default:
                throw new IllegalStateException("Unknown response: " + response);
        }
    }

    private synchronized Response nextResponse() {
        Response next = script.pollFirst();
        return next != null ? next : defaultResponse;
    }

    /**
     * Returns the number of persist calls.
     *
     * @return persist call count
     */
    public int persistCount() {
        return calls.size();
    }

    /**
     * Returns the recorded persist calls in order.
     *
     * @return recorded calls (snapshot)
     */
    public List<PersistCall> calls() {
        return List.copyOf(calls);
    }

    /**
     * Clears recorded calls and the remaining script.
     */
    public synchronized void clear() {
        calls.clear();
        script.clear();
    }

    /**
     * Collaborator fault raised by {@link Response#FAULT}.
     */
    public static class StoreFaultException extends RuntimeException {

        /**
         * Creates a fault.
         *
         * @param message the fault message
         */
        public StoreFaultException(String message) {
            super(message);
        }
    }
}
