package com.ryuqq.statekeeper.core.strategy;

import com.ryuqq.statekeeper.core.model.State;
import com.ryuqq.statekeeper.core.model.StateField;
import com.ryuqq.statekeeper.core.outcome.WriteOutcome;
import com.ryuqq.statekeeper.core.spi.Record;
import com.ryuqq.statekeeper.core.spi.Store;

/**
 * 즉시 저장(durable write) 전략.
 *
 * <p>"hard" 이벤트(즉시 저장을 의미하는 전이)에서 guard 통과 후, after 콜백 이전에
 * 이벤트당 정확히 한 번 호출됩니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>반환 시 필드 값은 target 상태(Committed) 또는 write 이전 raw 값(RolledBack)</li>
 *   <li>호출당 저장소 연산은 정확히 한 번</li>
 * </ul>
 *
 * @author Statekeeper Team
 * @since 1.0.0
 */
public interface DurableWriteStrategy {

    /**
     * 상태를 기록하고 저장.
     *
     * @param record 대상 Record
     * @param field 상태 필드
     * @param target 요청된 상태
     * @param store 저장소
     * @return Committed 또는 RolledBack
     */
    WriteOutcome write(Record record, StateField field, State target, Store store);
}
