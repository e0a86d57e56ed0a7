package com.ryuqq.statekeeper.core.strategy.standard;

import com.ryuqq.statekeeper.core.model.State;
import com.ryuqq.statekeeper.core.model.StateField;
import com.ryuqq.statekeeper.core.spi.Record;
import com.ryuqq.statekeeper.core.strategy.DeferredWriteStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 기본 지연 저장 구현.
 *
 * <p>필드에 target 상태의 문자열 표현을 기록합니다. 저장소에는 접근하지 않습니다.</p>
 *
 * @author Statekeeper Team
 * @since 1.0.0
 */
public final class StandardDeferredWriteStrategy implements DeferredWriteStrategy {

    private static final Logger log = LoggerFactory.getLogger(StandardDeferredWriteStrategy.class);

    @Override
    public void write(Record record, StateField field, State target) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        if (field == null) {
            throw new IllegalArgumentException("field cannot be null");
        }
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }

        record.set(field.getName(), target.value());
        log.debug("Deferred state write for record {}: {}={}", record.id(), field.getName(), target);
    }
}
