package com.ryuqq.statekeeper.adapter.inmemory.store;

import com.ryuqq.statekeeper.core.scope.StateScope;
import com.ryuqq.statekeeper.core.spi.PersistOptions;
import com.ryuqq.statekeeper.core.spi.Record;
import com.ryuqq.statekeeper.core.spi.Store;
import com.ryuqq.statekeeper.core.spi.ValidationResult;
import com.ryuqq.statekeeper.core.spi.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link Store} SPI for testing and reference purposes.
 *
 * <p>Documents are stored as attribute snapshots in a {@link ConcurrentHashMap} keyed by
 * document id. A save copies the document's attributes; later in-memory changes are not
 * visible to the store until the next save.</p>
 *
 * <p><strong>Persist Rules:</strong></p>
 * <ul>
 *   <li>{@code validate=true}: the configured {@link Validator} runs first; errors → {@code false}</li>
 *   <li>{@code validate=false}: the validator is bypassed</li>
 *   <li>Store constraints always run, like unique indexes; a violation → {@code false}</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Only {@link InMemoryDocument} records are accepted</li>
 *   <li>No transactions or optimistic locking</li>
 *   <li>Data lost on process restart</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryDocumentStore store = new InMemoryDocumentStore(orderValidator)
 *     .withConstraint("closed requires total", doc -&gt;
 *         !"closed".equals(doc.get("state")) || doc.get("total") != null);
 *
 * InMemoryDocument order = new InMemoryDocument();
 * coordinator.writeDurable(order, State.of("opened"), store);
 * store.find(scopes.get("opened")); // [order]
 * </pre>
 *
 * @author Statekeeper Team
 * @since 1.0.0
 */
public class InMemoryDocumentStore implements Store {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDocumentStore.class);

    /**
     * Persisted attribute snapshots.
     * Key: document id, Value: attributes at the last successful save
     */
    private final ConcurrentHashMap<String, Map<String, Object>> documents;

    private final List<Constraint> constraints;
    private final Validator validator;
    private final AtomicInteger persistCount;

    /**
     * Creates a store without validation rules.
     */
    public InMemoryDocumentStore() {
        this(Validator.NONE);
    }

    /**
     * Creates a store with the documents' validation rules.
     *
     * @param validator rules applied when {@code validate=true}
     * @throws IllegalArgumentException if validator is null
     */
    public InMemoryDocumentStore(Validator validator) {
        if (validator == null) {
            throw new IllegalArgumentException("validator cannot be null");
        }
        this.documents = new ConcurrentHashMap<>();
        this.constraints = new CopyOnWriteArrayList<>();
        this.validator = validator;
        this.persistCount = new AtomicInteger();
    }

    /**
     * Adds a store-level constraint checked on every save.
     *
     * @param name the constraint name (used in logs)
     * @param accepts predicate that returns true when the document may be saved
     * @return this
     * @throws IllegalArgumentException if name or accepts is null
     */
    public InMemoryDocumentStore withConstraint(String name, Predicate<Record> accepts) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (accepts == null) {
            throw new IllegalArgumentException("accepts cannot be null");
        }
        constraints.add(new Constraint(name, accepts));
        return this;
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Validation (optional) → constraints → snapshot copy</li>
     *   <li>Rejections are logged at DEBUG and reported as {@code false}</li>
     *   <li>Every call is counted, accepted or not</li>
     * </ul>
     */
    @Override
    public boolean persist(Record record, PersistOptions options) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
        if (!(record instanceof InMemoryDocument)) {
            throw new IllegalArgumentException(
                "InMemoryDocumentStore only persists InMemoryDocument, but was: " + record.getClass().getName());
        }
        persistCount.incrementAndGet();
        InMemoryDocument document = (InMemoryDocument) record;

        if (options.validate()) {
            ValidationResult result = validator.validate(document);
            if (!result.isValid()) {
                log.debug("Document {} rejected by validation: {}", document.id(), result.errors());
                return false;
            }
        }

        for (Constraint constraint : constraints) {
            if (!constraint.accepts().test(document)) {
                log.debug("Document {} rejected by constraint: {}", document.id(), constraint.name());
                return false;
            }
        }

        documents.put(document.id(), Collections.unmodifiableMap(document.attributes()));
        document.markPersisted();
        return true;
    }

    /**
     * Loads a fresh copy of a persisted document.
     *
     * @param id the document id
     * @return the document, or empty if never persisted
     * @throws IllegalArgumentException if id is null
     */
    public Optional<InMemoryDocument> find(String id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        Map<String, Object> persisted = documents.get(id);
        if (persisted == null) {
            return Optional.empty();
        }
        InMemoryDocument document = new InMemoryDocument(id);
        document.replaceAttributes(persisted);
        return Optional.of(document);
    }

    /**
     * Loads fresh copies of all persisted documents in the scope's state.
     *
     * @param scope the state scope
     * @return matching documents (may be empty)
     * @throws IllegalArgumentException if scope is null
     */
    public List<InMemoryDocument> find(StateScope scope) {
        if (scope == null) {
            throw new IllegalArgumentException("scope cannot be null");
        }
        return documents.keySet().stream()
                .sorted()
                .map(this::find)
                .flatMap(Optional::stream)
                .filter(scope::matches)
                .collect(Collectors.toList());
    }

    /**
     * Replaces the document's in-memory attributes with the persisted ones.
     *
     * @param document the document to reload
     * @throws IllegalArgumentException if document is null
     * @throws IllegalStateException if the document was never persisted
     */
    public void reload(InMemoryDocument document) {
        if (document == null) {
            throw new IllegalArgumentException("document cannot be null");
        }
        Map<String, Object> persisted = documents.get(document.id());
        if (persisted == null) {
            throw new IllegalStateException("No persisted document found for id: " + document.id());
        }
        document.replaceAttributes(persisted);
    }

    /**
     * Overwrites one persisted attribute, simulating a write by another process.
     *
     * @param id the document id
     * @param fieldName the attribute name
     * @param rawValue the new raw value
     * @throws IllegalStateException if the document was never persisted
     */
    public void overwrite(String id, String fieldName, Object rawValue) {
        Map<String, Object> persisted = documents.get(id);
        if (persisted == null) {
            throw new IllegalStateException("No persisted document found for id: " + id);
        }
        Map<String, Object> changed = new LinkedHashMap<>(persisted);
        changed.put(fieldName, rawValue);
        documents.put(id, Collections.unmodifiableMap(changed));
    }

    /**
     * Returns a persisted attribute value.
     *
     * <p>This method is used for test assertions.</p>
     *
     * @param id the document id
     * @param fieldName the attribute name
     * @return the persisted value, or null if the document or attribute is absent
     */
    public Object persistedValue(String id, String fieldName) {
        Map<String, Object> persisted = documents.get(id);
        return persisted != null ? persisted.get(fieldName) : null;
    }

    /**
     * Returns the number of persisted documents.
     *
     * @return document count
     */
    public int count() {
        return documents.size();
    }

    /**
     * Returns the number of persist calls, accepted or rejected.
     *
     * @return persist call count
     */
    public int persistCount() {
        return persistCount.get();
    }

    /**
     * Clears all stored data.
     *
     * <p>This method is used for test cleanup.</p>
     */
    public void clear() {
        documents.clear();
        persistCount.set(0);
    }

    /**
     * Store-level constraint.
     *
     * @param name the constraint name
     * @param accepts predicate that returns true when the document may be saved
     */
    private record Constraint(String name, Predicate<Record> accepts) {
    }
}
