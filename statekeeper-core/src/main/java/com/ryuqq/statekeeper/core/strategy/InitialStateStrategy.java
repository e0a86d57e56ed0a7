package com.ryuqq.statekeeper.core.strategy;

import com.ryuqq.statekeeper.core.model.StateField;
import com.ryuqq.statekeeper.core.spi.InitialStateSupplier;
import com.ryuqq.statekeeper.core.spi.Record;

/**
 * 초기 상태 보장 전략.
 *
 * <p>검증(validation) 직전에 호출되며, 상태 필드가 blank인 경우에만 초기 상태를 기록합니다.
 * blank가 아닌 값은 어떤 경우에도 덮어쓰지 않습니다.</p>
 *
 * @author Statekeeper Team
 * @since 1.0.0
 */
public interface InitialStateStrategy {

    /**
     * 필요한 경우 초기 상태 기록.
     *
     * @param record 대상 Record
     * @param field 상태 필드
     * @param supplier 초기 상태 공급자
     * @return 초기 상태를 기록한 경우 true, 기존 값을 유지한 경우 false
     */
    boolean ensureInitialState(Record record, StateField field, InitialStateSupplier supplier);
}
