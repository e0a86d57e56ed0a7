package com.ryuqq.statekeeper.core.strategy.standard;

import com.ryuqq.statekeeper.core.model.State;
import com.ryuqq.statekeeper.core.model.StateField;
import com.ryuqq.statekeeper.core.spi.InitialStateSupplier;
import com.ryuqq.statekeeper.core.spi.Record;
import com.ryuqq.statekeeper.core.strategy.InitialStateStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 기본 초기 상태 보장 구현.
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>필드의 raw 값이 blank가 아니면 아무것도 하지 않음 (새 Record 여부와 무관)</li>
 *   <li>blank이면 supplier로 초기 상태를 계산</li>
 *   <li>계산된 상태의 문자열 표현을 필드에 직접 기록 (저장소 접근 없음)</li>
 * </ol>
 *
 * <p>supplier가 blank 상태(또는 null)를 반환하면 빈 문자열을 기록하고 경고 로그를 남깁니다.
 * 이는 런타임 오류가 아니라 FSM 정의의 설정 결함입니다.</p>
 *
 * @author Statekeeper Team
 * @since 1.0.0
 */
public final class StandardInitialStateStrategy implements InitialStateStrategy {

    private static final Logger log = LoggerFactory.getLogger(StandardInitialStateStrategy.class);

    @Override
    public boolean ensureInitialState(Record record, StateField field, InitialStateSupplier supplier) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        if (field == null) {
            throw new IllegalArgumentException("field cannot be null");
        }
        if (supplier == null) {
            throw new IllegalArgumentException("supplier cannot be null");
        }

        Object current = record.get(field.getName());
        if (!State.isBlank(current)) {
            return false;
        }

        State initial = supplier.compute(record);
        if (initial == null || initial.isBlank()) {
            log.warn("Initial state supplier returned a blank state for record {}; "
                + "check the initial state of the state machine definition", record.id());
            initial = State.BLANK;
        }

        record.set(field.getName(), initial.value());
        log.debug("Initial state populated for record {}: {}={}", record.id(), field.getName(), initial);
        return true;
    }
}
