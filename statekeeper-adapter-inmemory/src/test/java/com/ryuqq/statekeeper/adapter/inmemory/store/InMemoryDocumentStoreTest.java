package com.ryuqq.statekeeper.adapter.inmemory.store;

import com.ryuqq.statekeeper.core.model.State;
import com.ryuqq.statekeeper.core.model.StateField;
import com.ryuqq.statekeeper.core.scope.StateScope;
import com.ryuqq.statekeeper.core.spi.PersistOptions;
import com.ryuqq.statekeeper.core.spi.Record;
import com.ryuqq.statekeeper.core.spi.ValidationResult;
import com.ryuqq.statekeeper.core.spi.Validator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryDocumentStore 단위 테스트.
 *
 * @author Statekeeper Team
 * @since 1.0.0
 */
class InMemoryDocumentStoreTest {

    private static final Validator REQUIRES_TOTAL = doc ->
            doc.get("total") == null ? ValidationResult.of("total is required") : ValidationResult.valid();

    private InMemoryDocumentStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryDocumentStore(REQUIRES_TOTAL);
    }

    @Test
    @DisplayName("validate=true 이면 검증 실패 시 저장하지 않는다")
    void persist_validating_rejectsInvalidDocument() {
        // given
        InMemoryDocument document = new InMemoryDocument("order-1");
        document.set("state", "pending");

        // when
        boolean saved = store.persist(document, PersistOptions.validating());

        // then
        assertThat(saved).isFalse();
        assertThat(store.count()).isZero();
        assertThat(store.persistCount()).isEqualTo(1);
        assertThat(document.isNewRecord()).isTrue();
    }

    @Test
    @DisplayName("validate=false 이면 검증 규칙을 우회한다")
    void persist_skipValidation_bypassesValidator() {
        // given
        InMemoryDocument document = new InMemoryDocument("order-1");
        document.set("state", "pending");

        // when
        boolean saved = store.persist(document, PersistOptions.skipValidation());

        // then
        assertThat(saved).isTrue();
        assertThat(store.persistedValue("order-1", "state")).isEqualTo("pending");
        assertThat(document.isNewRecord()).isFalse();
    }

    @Test
    @DisplayName("제약 조건은 validate 옵션과 무관하게 항상 적용된다")
    void persist_constraintViolation_rejects() {
        // given
        store.withConstraint("closed requires total",
                doc -> !"closed".equals(doc.get("state")) || doc.get("total") != null);
        InMemoryDocument document = new InMemoryDocument("order-1");
        document.set("state", "closed");

        // when
        boolean saved = store.persist(document, PersistOptions.skipValidation());

        // then
        assertThat(saved).isFalse();
        assertThat(store.find("order-1")).isEmpty();
    }

    @Test
    @DisplayName("저장 이후의 메모리 변경은 reload 로 버려진다")
    void reload_discardsUnsavedChanges() {
        // given
        InMemoryDocument document = new InMemoryDocument("order-1");
        document.set("state", "opened");
        store.persist(document, PersistOptions.skipValidation());
        document.set("state", "closed");

        // when
        store.reload(document);

        // then
        assertThat(document.get("state")).isEqualTo("opened");
    }

    @Test
    @DisplayName("저장되지 않은 문서의 reload 는 IllegalStateException")
    void reload_unknownDocument_throws() {
        InMemoryDocument document = new InMemoryDocument("missing");

        assertThatThrownBy(() -> store.reload(document))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("missing");
    }

    @Test
    @DisplayName("overwrite 는 다른 프로세스의 저장을 흉내낸다")
    void overwrite_changesPersistedCopyOnly() {
        // given
        InMemoryDocument document = new InMemoryDocument("order-1");
        document.set("state", "opened");
        store.persist(document, PersistOptions.skipValidation());

        // when
        store.overwrite("order-1", "state", "closed");

        // then
        assertThat(document.get("state")).isEqualTo("opened");
        assertThat(store.find("order-1")).hasValueSatisfying(found ->
                assertThat(found.get("state")).isEqualTo("closed"));
    }

    @Test
    @DisplayName("scope 조회는 저장된 상태가 일치하는 문서만 반환한다")
    void findByScope_returnsMatchingDocuments() {
        // given
        persistWithState("order-1", "opened");
        persistWithState("order-2", "closed");
        persistWithState("order-3", "opened");
        StateScope opened = new StateScope("opened", StateField.defaultField(), State.of("opened"));

        // when
        List<InMemoryDocument> found = store.find(opened);

        // then
        assertThat(found).extracting(InMemoryDocument::id).containsExactly("order-1", "order-3");
    }

    @Test
    @DisplayName("InMemoryDocument 가 아닌 Record 는 거부한다")
    void persist_foreignRecord_throws() {
        Record foreign = new Record() {
            @Override
            public String id() {
                return "foreign";
            }

            @Override
            public Object get(String fieldName) {
                return null;
            }

            @Override
            public void set(String fieldName, Object rawValue) {
            }
        };

        assertThatThrownBy(() -> store.persist(foreign, PersistOptions.skipValidation()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("InMemoryDocument");
    }

    @Test
    @DisplayName("clear 는 문서와 호출 횟수를 초기화한다")
    void clear_resetsEverything() {
        persistWithState("order-1", "opened");

        store.clear();

        assertThat(store.count()).isZero();
        assertThat(store.persistCount()).isZero();
    }

    private void persistWithState(String id, String state) {
        InMemoryDocument document = new InMemoryDocument(id);
        document.set("state", state);
        store.persist(document, PersistOptions.skipValidation());
    }
}
