package com.ryuqq.statekeeper.core.strategy;

import com.ryuqq.statekeeper.core.model.State;
import com.ryuqq.statekeeper.core.model.StateField;
import com.ryuqq.statekeeper.core.spi.Record;

/**
 * 현재 상태 읽기 전략.
 *
 * <p>구현체는 호출마다 Record에서 값을 다시 읽어야 합니다 (캐시 금지).
 * 외부에서 Record를 reload하거나 필드를 직접 변경한 경우 그 값이 즉시 반영되어야 합니다.</p>
 *
 * @author Statekeeper Team
 * @since 1.0.0
 */
public interface ReadStateStrategy {

    /**
     * 상태 필드의 raw 값 읽기.
     *
     * @param record 대상 Record
     * @param field 상태 필드
     * @return raw 값 (미설정인 경우 null)
     */
    Object readRaw(Record record, StateField field);

    /**
     * 상태 필드를 State로 변환하여 읽기.
     *
     * @param record 대상 Record
     * @param field 상태 필드
     * @return 현재 상태 (미설정인 경우 {@link State#BLANK})
     */
    default State read(Record record, StateField field) {
        return State.of(readRaw(record, field));
    }
}
