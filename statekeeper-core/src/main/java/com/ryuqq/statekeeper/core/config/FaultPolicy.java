package com.ryuqq.statekeeper.core.config;

/**
 * Store 장애(CollaboratorFault) 발생 시 durable write의 동작.
 *
 * <p>저장소가 {@code false}가 아닌 예외로 실패하면 저장 여부를 알 수 없습니다.
 * 두 정책 모두 예외를 그대로 호출자에게 전파하며, 차이는 메모리 상의 필드 값뿐입니다.</p>
 *
 * <pre>
 * PROPAGATE             : 필드 = target 상태 (기록된 그대로), 예외 전파
 * RESTORE_AND_PROPAGATE : 필드 = 이전 raw 값으로 복원, 예외 전파
 * </pre>
 *
 * <p>어느 경우든 재시도 전에 Record를 저장소에서 다시 읽어야 합니다.</p>
 *
 * @author Statekeeper Team
 * @since 1.0.0
 */
public enum FaultPolicy {

    /**
     * 필드를 건드리지 않고 예외 전파 (기본값).
     */
    PROPAGATE,

    /**
     * 필드를 이전 raw 값으로 복원한 뒤 예외 전파.
     */
    RESTORE_AND_PROPAGATE;

    /**
     * 예외 전파 전에 필드를 복원해야 하는지 확인.
     *
     * @return RESTORE_AND_PROPAGATE인 경우 true
     */
    public boolean restoresBeforePropagating() {
        return this == RESTORE_AND_PROPAGATE;
    }
}
