package com.ryuqq.statekeeper.core.outcome;

import com.ryuqq.statekeeper.core.model.State;

/**
 * 저장 거부로 인한 롤백.
 *
 * <p>저장소가 저장을 거부하여 Record의 상태 필드가 write 이전의 raw 값으로
 * 정확히 복원되었음을 나타냅니다. 이전 값이 설정되지 않았던 경우 previousValue는 null입니다.</p>
 *
 * @param previousValue 복원된 이전 raw 값 (null 허용)
 * @param requested 거부된 target 상태
 *
 * @author Statekeeper Team
 * @since 1.0.0
 */
public record RolledBack(
    Object previousValue,
    State requested
) implements WriteOutcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException requested가 null인 경우
     */
    public RolledBack {
        if (requested == null) {
            throw new IllegalArgumentException("requested cannot be null");
        }
        // previousValue는 null 허용 (미설정 필드)
    }

    /**
     * 복원된 값을 State로 변환.
     *
     * @return 이전 상태 (미설정이었던 경우 {@link State#BLANK})
     */
    public State previousState() {
        return State.of(previousValue);
    }
}
