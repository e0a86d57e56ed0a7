package com.ryuqq.statekeeper.testkit.contract;

import com.ryuqq.statekeeper.core.spi.Record;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Map-backed {@link Record} for contract tests.
 *
 * <p>Fields live in a plain {@link HashMap}; {@link #reload(Map)} replaces every field at
 * once to simulate re-reading the record from its store.</p>
 *
 * <p><strong>Limitations:</strong> not thread-safe, like a real document instance.</p>
 *
 * @author Statekeeper Team
 * @since 1.0.0
 */
public class MapRecord implements Record {

    private final String id;
    private final Map<String, Object> fields;

    /**
     * Creates an empty record with a random id.
     */
    public MapRecord() {
        this(UUID.randomUUID().toString());
    }

    /**
     * Creates an empty record.
     *
     * @param id the record id
     * @throws IllegalArgumentException if id is null or blank
     */
    public MapRecord(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        this.id = id;
        this.fields = new HashMap<>();
    }

    /**
     * Creates a record with one field set.
     *
     * @param fieldName the field name
     * @param rawValue the raw value (null allowed)
     * @return a new record
     */
    public static MapRecord with(String fieldName, Object rawValue) {
        MapRecord record = new MapRecord();
        record.set(fieldName, rawValue);
        return record;
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
        return fields.get(fieldName);
    }

    @Override
    public void set(String fieldName, Object rawValue) {
        if (fieldName == null) {
            throw new IllegalArgumentException("fieldName cannot be null");
        }
        fields.put(fieldName, rawValue);
    }

    /**
     * Replaces all fields with the given snapshot.
     *
     * @param snapshot the persisted field values
     * @throws IllegalArgumentException if snapshot is null
     */
    public void reload(Map<String, Object> snapshot) {
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot cannot be null");
        }
        fields.clear();
        fields.putAll(snapshot);
    }

    /**
     * Returns a copy of all fields.
     *
     * @return field snapshot
     */
    public Map<String, Object> snapshot() {
        return new HashMap<>(fields);
    }

    @Override
    public String toString() {
        return "MapRecord{" + id + ", " + fields + '}';
    }
}
