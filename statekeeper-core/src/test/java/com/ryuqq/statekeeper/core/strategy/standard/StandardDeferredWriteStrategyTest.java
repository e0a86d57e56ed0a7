package com.ryuqq.statekeeper.core.strategy.standard;

import com.ryuqq.statekeeper.core.model.State;
import com.ryuqq.statekeeper.core.model.StateField;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * StandardDeferredWriteStrategy 유닛 테스트.
 *
 * @author Statekeeper Team
 * @since 1.0.0
 */
class StandardDeferredWriteStrategyTest {

    private final StateField field = StateField.of("state");
    private final StandardDeferredWriteStrategy strategy = new StandardDeferredWriteStrategy();

    @Test
    void write_메모리_필드만_변경() {
        // given
        FakeRecord record = new FakeRecord("state", "opened");

        // when
        strategy.write(record, field, State.of("closed"));

        // then
        assertThat(record.get("state")).isEqualTo("closed");
    }

    @Test
    void write_BLANK는_빈_문자열로_기록() {
        // given
        FakeRecord record = new FakeRecord("state", "opened");

        // when
        strategy.write(record, field, State.BLANK);

        // then
        assertThat(record.get("state")).isEqualTo("");
    }

    @Test
    void write_null_target은_거부() {
        FakeRecord record = new FakeRecord("state", "opened");
        assertThatThrownBy(() -> strategy.write(record, field, null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(record.get("state")).isEqualTo("opened");
    }
}
