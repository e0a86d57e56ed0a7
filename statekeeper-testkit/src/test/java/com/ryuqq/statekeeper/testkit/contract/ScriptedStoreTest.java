package com.ryuqq.statekeeper.testkit.contract;

import com.ryuqq.statekeeper.core.spi.PersistOptions;
import com.ryuqq.statekeeper.core.spi.PersistenceRejectedException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * ScriptedStore 유닛 테스트.
 *
 * @author Statekeeper Team
 * @since 1.0.0
 */
class ScriptedStoreTest {

    @Test
    void 스크립트를_순서대로_소비한_뒤_기본_응답() {
        // given
        ScriptedStore store = ScriptedStore.accepting()
            .then(ScriptedStore.Response.REJECT, ScriptedStore.Response.REJECT_BY_EXCEPTION);
        MapRecord record = new MapRecord("r-1");

        // when & then
        assertThat(store.persist(record, PersistOptions.skipValidation())).isFalse();
        PersistenceRejectedException rejected = catchThrowableOfType(
            () -> store.persist(record, PersistOptions.skipValidation()), PersistenceRejectedException.class);
        assertThat(rejected).isNotNull();
        assertThat(rejected.getRecordId()).isEqualTo("r-1");
        assertThat(store.persist(record, PersistOptions.skipValidation())).isTrue();
        assertThat(store.persistCount()).isEqualTo(3);
    }

    @Test
    void observing_필드_값을_기록() {
        // given
        ScriptedStore store = ScriptedStore.rejecting().observing("state");
        MapRecord record = MapRecord.with("state", "opened");

        // when
        store.persist(record, PersistOptions.validating());

        // then
        ScriptedStore.PersistCall call = store.calls().get(0);
        assertThat(call.fieldValue()).isEqualTo("opened");
        assertThat(call.options().validate()).isTrue();
        assertThat(call.recordId()).isEqualTo(record.id());
    }

    @Test
    void clear_기록과_스크립트_초기화() {
        // given
        ScriptedStore store = ScriptedStore.accepting().then(ScriptedStore.Response.FAULT);
        store.clear();

        // when
        boolean saved = store.persist(new MapRecord(), PersistOptions.skipValidation());

        // then
        assertThat(saved).isTrue();
        assertThat(store.calls()).hasSize(1);
    }

    @Test
    void MapRecord_reload_모든_필드_교체() {
        // given
        MapRecord record = MapRecord.with("state", "closed");
        record.set("name", "order");

        // when
        record.reload(Map.of("state", "opened"));

        // then
        assertThat(record.get("state")).isEqualTo("opened");
        assertThat(record.get("name")).isNull();
    }
}
