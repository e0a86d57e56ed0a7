package com.ryuqq.statekeeper.core.model;

import java.util.Collection;
import java.util.Map;

/**
 * FSM 상태 레이블.
 *
 * <p>외부 FSM 엔진이 선언한 상태 집합에서 선택된 문자열 값입니다.
 * 이 클래스는 값을 불투명한 문자열로 취급하며, 선언된 상태인지 여부는 검증하지 않습니다
 * (FSM 엔진의 책임).</p>
 *
 * <p><strong>Blank 판정 규칙 ({@link #isBlank(Object)}):</strong></p>
 * <ul>
 *   <li>null</li>
 *   <li>비어 있거나 공백 문자로만 구성된 문자열</li>
 *   <li>{@link Boolean#FALSE}</li>
 *   <li>비어 있는 Collection 또는 Map</li>
 * </ul>
 *
 * <p>{@code "0"} 같은 값은 blank가 아닙니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * State opened = State.of("opened");
 * State current = State.of(record.get("state")); // null, "" → State.BLANK
 *
 * if (current.isBlank()) {
 *     // 초기 상태 미설정
 * }
 * </pre>
 *
 * @author Statekeeper Team
 * @since 1.0.0
 */
public final class State {

    /**
     * 상태가 설정되지 않았음을 나타내는 sentinel (값: 빈 문자열).
     */
    public static final State BLANK = new State("");

    private final String value;

    private State(String value) {
        this.value = value;
    }

    /**
     * raw 값으로부터 State 생성.
     *
     * <p>raw 값은 {@code toString()}으로 문자열 표현으로 변환되며, 공백 문자도 그대로 보존합니다.
     * null 또는 빈 문자열만 {@link #BLANK}를 반환합니다. 초기 상태 필요 여부는
     * {@link #isBlank(Object)}로 판정합니다.</p>
     *
     * @param raw 상태 raw 값 (null 허용)
     * @return State 인스턴스
     */
    public static State of(Object raw) {
        if (raw == null) {
            return BLANK;
        }
        String value = raw.toString();
        if (value.isEmpty()) {
            return BLANK;
        }
        return new State(value);
    }

    /**
     * raw 값이 blank인지 확인.
     *
     * @param raw 검사할 값 (null 허용)
     * @return blank인 경우 true
     */
    public static boolean isBlank(Object raw) {
        if (raw == null) {
            return true;
        }
        if (raw instanceof CharSequence) {
            return raw.toString().isBlank();
        }
        if (raw instanceof Boolean) {
            return !((Boolean) raw);
        }
        if (raw instanceof Collection) {
            return ((Collection<?>) raw).isEmpty();
        }
        if (raw instanceof Map) {
            return ((Map<?, ?>) raw).isEmpty();
        }
        return false;
    }

    /**
     * 상태 값 조회.
     *
     * @return 상태 문자열 ({@link #BLANK}인 경우 빈 문자열)
     */
    public String value() {
        return value;
    }

    /**
     * blank 여부 확인.
     *
     * @return {@link #BLANK}이거나 공백 문자로만 구성된 경우 true
     */
    public boolean isBlank() {
        return value.isBlank();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        State state = (State) o;
        return value.equals(state.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    /**
     * 상태 문자열 반환.
     *
     * <p>Record 필드에 기록되는 값과 동일합니다.</p>
     *
     * @return 상태 문자열
     */
    @Override
    public String toString() {
        return value;
    }
}
