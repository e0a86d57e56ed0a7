package com.ryuqq.statekeeper.core.outcome;

import com.ryuqq.statekeeper.core.model.State;

/**
 * Durable write 실행 결과.
 *
 * <p>WriteOutcome은 두 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Committed}: 상태가 변경되고 저장소에 저장됨</li>
 *   <li>{@link RolledBack}: 저장이 거부되어 필드가 이전 raw 값으로 복원됨</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 두 케이스 외의 구현을 허용하지 않습니다.
 * 호출자는 결과에 따라 전이 후속 작업(콜백 등) 실행 여부를 결정해야 합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * WriteOutcome outcome = coordinator.writeDurable(record, State.of("closed"), store);
 * if (outcome.isCommitted()) {
 *     // after-transition 콜백 실행
 * } else {
 *     RolledBack rolledBack = (RolledBack) outcome;
 *     log.info("close rejected, state stays {}", rolledBack.previousValue());
 * }
 * </pre>
 *
 * @author Statekeeper Team
 * @since 1.0.0
 */
public sealed interface WriteOutcome permits Committed, RolledBack {

    /**
     * 이번 write에서 요청된 상태.
     *
     * @return 요청된 target 상태
     */
    State requested();

    /**
     * 저장 성공 여부 확인.
     *
     * @return Committed인 경우 true
     */
    default boolean isCommitted() {
        return this instanceof Committed;
    }

    /**
     * 롤백 여부 확인.
     *
     * @return RolledBack인 경우 true
     */
    default boolean isRolledBack() {
        return this instanceof RolledBack;
    }
}
