package com.ryuqq.statekeeper.core.strategy.standard;

import com.ryuqq.statekeeper.core.model.StateField;
import com.ryuqq.statekeeper.core.spi.Record;
import com.ryuqq.statekeeper.core.strategy.ReadStateStrategy;

/**
 * 기본 상태 읽기 구현.
 *
 * <p>매 호출마다 {@link Record#get(String)}을 그대로 호출합니다. 값을 보관하지 않으므로
 * reload나 필드 직접 변경이 즉시 반영됩니다.</p>
 *
 * @author Statekeeper Team
 * @since 1.0.0
 */
public final class StandardReadStateStrategy implements ReadStateStrategy {

    @Override
    public Object readRaw(Record record, StateField field) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        if (field == null) {
            throw new IllegalArgumentException("field cannot be null");
        }
        return record.get(field.getName());
    }
}
