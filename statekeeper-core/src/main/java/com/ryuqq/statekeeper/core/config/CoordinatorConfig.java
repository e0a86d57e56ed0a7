package com.ryuqq.statekeeper.core.config;

import com.ryuqq.statekeeper.core.model.StateField;

/**
 * Coordinator 설정 (불변 record).
 *
 * <p>엔티티 타입마다 하나씩 생성되며, 생성 후 변경되지 않습니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>stateField: 상태를 저장하는 필드 (기본 "state")</li>
 *   <li>faultPolicy: 저장소 장애 시 동작 (기본 PROPAGATE)</li>
 * </ul>
 *
 * @author Statekeeper Team
 * @since 1.0.0
 * @param stateField 상태 필드 (null 불가)
 * @param faultPolicy 저장소 장애 정책 (null 불가)
 */
public record CoordinatorConfig(StateField stateField, FaultPolicy faultPolicy) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: stateField="state", faultPolicy=PROPAGATE</p>
     */
    public CoordinatorConfig() {
        this(StateField.defaultField(), FaultPolicy.PROPAGATE);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public CoordinatorConfig {
        if (stateField == null) {
            throw new IllegalArgumentException("stateField cannot be null");
        }
        if (faultPolicy == null) {
            throw new IllegalArgumentException("faultPolicy cannot be null");
        }
    }

    /**
     * 상태 필드 이름만 지정한 설정 생성.
     *
     * @param stateFieldName 필드 이름
     * @return 새 CoordinatorConfig 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 필드 이름인 경우
     */
    public static CoordinatorConfig forField(String stateFieldName) {
        return new CoordinatorConfig(StateField.of(stateFieldName), FaultPolicy.PROPAGATE);
    }

    /**
     * stateField만 변경한 새 인스턴스 생성.
     *
     * @param stateField 새로운 상태 필드
     * @return 새 CoordinatorConfig 인스턴스
     */
    public CoordinatorConfig withStateField(StateField stateField) {
        return new CoordinatorConfig(stateField, this.faultPolicy);
    }

    /**
     * faultPolicy만 변경한 새 인스턴스 생성.
     *
     * @param faultPolicy 새로운 장애 정책
     * @return 새 CoordinatorConfig 인스턴스
     */
    public CoordinatorConfig withFaultPolicy(FaultPolicy faultPolicy) {
        return new CoordinatorConfig(this.stateField, faultPolicy);
    }
}
