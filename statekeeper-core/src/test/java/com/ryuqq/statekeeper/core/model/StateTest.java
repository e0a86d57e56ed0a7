package com.ryuqq.statekeeper.core.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * State 테스트.
 *
 * <p>blank 판정 규칙과 raw 값 변환을 검증합니다.</p>
 *
 * @author Statekeeper Team
 * @since 1.0.0
 */
class StateTest {

    @Test
    void of_문자열_값을_그대로_보존() {
        // when
        State state = State.of("opened");

        // then
        assertThat(state.value()).isEqualTo("opened");
        assertThat(state.toString()).isEqualTo("opened");
        assertThat(state.isBlank()).isFalse();
    }

    @Test
    void of_null과_빈_문자열은_BLANK() {
        assertThat(State.of(null)).isSameAs(State.BLANK);
        assertThat(State.of("")).isSameAs(State.BLANK);
        assertThat(State.BLANK.value()).isEmpty();
    }

    @Test
    void of_공백_문자열은_저장된_값_그대로_보존() {
        // when
        State state = State.of("  ");

        // then
        assertThat(state).isNotSameAs(State.BLANK);
        assertThat(state.value()).isEqualTo("  ");
        assertThat(state.isBlank()).isTrue();
    }

    @Test
    void of_문자열이_아닌_값은_toString으로_변환() {
        // when
        State state = State.of(42);

        // then
        assertThat(state.value()).isEqualTo("42");
    }

    @Test
    void isBlank_falsy지만_blank가_아닌_값() {
        assertThat(State.isBlank("0")).isFalse();
        assertThat(State.isBlank(0)).isFalse();
        assertThat(State.isBlank("false")).isFalse();
        assertThat(State.isBlank(Boolean.TRUE)).isFalse();
    }

    @Test
    void isBlank_blank로_판정되는_값() {
        assertThat(State.isBlank(null)).isTrue();
        assertThat(State.isBlank("\t\n")).isTrue();
        assertThat(State.isBlank(Boolean.FALSE)).isTrue();
        assertThat(State.isBlank(List.of())).isTrue();
        assertThat(State.isBlank(Map.of())).isTrue();
        assertThat(State.isBlank(new StringBuilder())).isTrue();
    }

    @Test
    void equals_같은_값이면_동일() {
        assertThat(State.of("closed")).isEqualTo(State.of("closed"));
        assertThat(State.of("closed")).hasSameHashCodeAs(State.of("closed"));
        assertThat(State.of("closed")).isNotEqualTo(State.of("opened"));
    }
}
