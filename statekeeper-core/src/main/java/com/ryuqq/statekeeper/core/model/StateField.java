package com.ryuqq.statekeeper.core.model;

/**
 * 상태 값을 저장하는 Record 필드의 이름.
 *
 * <p>엔티티 타입마다 한 번 설정되며, 이후 변경되지 않습니다.
 * Coordinator는 이 이름을 통해 {@link com.ryuqq.statekeeper.core.spi.Record}의
 * 상태 필드를 읽고 씁니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영문자 또는 언더스코어(_)로 시작, 이후 영숫자와 언더스코어만 허용</li>
 * </ul>
 *
 * @author Statekeeper Team
 * @since 1.0.0
 */
public final class StateField {

    /**
     * 별도 설정이 없을 때 사용하는 필드 이름.
     */
    public static final String DEFAULT_NAME = "state";

    private final String name;

    private StateField(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("StateField name cannot be null or blank");
        }
        if (name.length() > 255) {
            throw new IllegalArgumentException("StateField name length cannot exceed 255 characters");
        }
        if (!name.matches("^[a-zA-Z_][a-zA-Z0-9_]*$")) {
            throw new IllegalArgumentException(
                "StateField name contains invalid characters. Only alphanumeric and underscore are allowed, "
                    + "and it cannot start with a digit (current: " + name + ")");
        }
        this.name = name;
    }

    /**
     * StateField 생성.
     *
     * @param name 필드 이름
     * @return StateField 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 이름인 경우
     */
    public static StateField of(String name) {
        return new StateField(name);
    }

    /**
     * 기본 이름({@value #DEFAULT_NAME})의 StateField 생성.
     *
     * @return StateField 인스턴스
     */
    public static StateField defaultField() {
        return new StateField(DEFAULT_NAME);
    }

    /**
     * 필드 이름 조회.
     *
     * @return 필드 이름
     */
    public String getName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StateField that = (StateField) o;
        return name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return "StateField{" + name + '}';
    }
}
