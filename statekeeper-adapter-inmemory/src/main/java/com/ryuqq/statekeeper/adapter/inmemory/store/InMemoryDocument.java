package com.ryuqq.statekeeper.adapter.inmemory.store;

import com.ryuqq.statekeeper.core.spi.Record;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Document {@link Record} held in memory and saved by {@link InMemoryDocumentStore}.
 *
 * <p>The id is generated on creation, as document mappers do client-side. Field changes stay
 * in memory until the document is persisted; {@link InMemoryDocumentStore#reload(InMemoryDocument)}
 * discards them.</p>
 *
 * @author Statekeeper Team
 * @since 1.0.0
 */
public class InMemoryDocument implements Record {

    private final String id;
    private final Map<String, Object> attributes;
    private boolean newRecord;

    /**
     * Creates a new, unsaved document with a generated id.
     */
    public InMemoryDocument() {
        this(UUID.randomUUID().toString());
    }

    /**
     * Creates a new, unsaved document.
     *
     * @param id the document id
     * @throws IllegalArgumentException if id is null or blank
     */
    public InMemoryDocument(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        this.id = id;
        this.attributes = new LinkedHashMap<>();
        this.newRecord = true;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public Object get(String fieldName) {
        if (fieldName == null) {
            throw new IllegalArgumentException("fieldName cannot be null");
        }
        return attributes.get(fieldName);
    }

    @Override
    public void set(String fieldName, Object rawValue) {
        if (fieldName == null) {
            throw new IllegalArgumentException("fieldName cannot be null");
        }
        attributes.put(fieldName, rawValue);
    }

    /**
     * Checks whether the document was never persisted.
     *
     * @return true until the first successful save
     */
    public boolean isNewRecord() {
        return newRecord;
    }

    /**
     * Returns a copy of all attributes.
     *
     * @return attribute snapshot
     */
    public Map<String, Object> attributes() {
        return new LinkedHashMap<>(attributes);
    }

    void markPersisted() {
        this.newRecord = false;
    }

    void replaceAttributes(Map<String, Object> persisted) {
        attributes.clear();
        attributes.putAll(persisted);
        this.newRecord = false;
    }

    @Override
    public String toString() {
        return "InMemoryDocument{" + id + ", " + attributes + '}';
    }
}
