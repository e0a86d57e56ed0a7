package com.ryuqq.statekeeper.core.strategy;

import com.ryuqq.statekeeper.core.model.State;
import com.ryuqq.statekeeper.core.model.StateField;
import com.ryuqq.statekeeper.core.spi.Record;

/**
 * 지연 저장(deferred write) 전략.
 *
 * <p>"soft" 이벤트에서 호출되며, 메모리 상의 필드만 변경합니다.
 * 저장소에는 절대 접근하지 않으며, 저장은 호출자가 이후에 별도로 수행합니다.</p>
 *
 * @author Statekeeper Team
 * @since 1.0.0
 */
public interface DeferredWriteStrategy {

    /**
     * 상태를 메모리에만 기록.
     *
     * @param record 대상 Record
     * @param field 상태 필드
     * @param target 요청된 상태
     */
    void write(Record record, StateField field, State target);
}
