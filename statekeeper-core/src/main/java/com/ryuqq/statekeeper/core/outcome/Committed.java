package com.ryuqq.statekeeper.core.outcome;

import com.ryuqq.statekeeper.core.model.State;

/**
 * 저장 성공.
 *
 * <p>Record의 상태 필드가 요청된 상태로 변경되었고, 저장소에 저장되었음을 나타냅니다.</p>
 *
 * @param requested 저장된 상태
 *
 * @author Statekeeper Team
 * @since 1.0.0
 */
public record Committed(State requested) implements WriteOutcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException requested가 null인 경우
     */
    public Committed {
        if (requested == null) {
            throw new IllegalArgumentException("requested cannot be null");
        }
    }

    /**
     * Committed 생성.
     *
     * @param state 저장된 상태
     * @return Committed 인스턴스
     */
    public static Committed of(State state) {
        return new Committed(state);
    }
}
