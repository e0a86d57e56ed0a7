package com.ryuqq.statekeeper.application.coordinator;

import com.ryuqq.statekeeper.core.spi.Record;

import java.util.HashMap;
import java.util.Map;

/**
 * 테스트용 Map 기반 Record.
 */
class TestRecord implements Record {

    private final String id;
    private final Map<String, Object> fields = new HashMap<>();

    TestRecord(String id) {
        this.id = id;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public Object get(String fieldName) {
        return fields.get(fieldName);
    }

    @Override
    public void set(String fieldName, Object rawValue) {
        fields.put(fieldName, rawValue);
    }
}
