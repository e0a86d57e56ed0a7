package com.ryuqq.statekeeper.application.coordinator;

import com.ryuqq.statekeeper.core.config.CoordinatorConfig;
import com.ryuqq.statekeeper.core.model.State;
import com.ryuqq.statekeeper.core.model.StateField;
import com.ryuqq.statekeeper.core.outcome.WriteOutcome;
import com.ryuqq.statekeeper.core.spi.InitialStateSupplier;
import com.ryuqq.statekeeper.core.spi.Record;
import com.ryuqq.statekeeper.core.spi.Store;
import com.ryuqq.statekeeper.core.strategy.DeferredWriteStrategy;
import com.ryuqq.statekeeper.core.strategy.DurableWriteStrategy;
import com.ryuqq.statekeeper.core.strategy.InitialStateStrategy;
import com.ryuqq.statekeeper.core.strategy.ReadStateStrategy;
import com.ryuqq.statekeeper.core.strategy.standard.StandardDeferredWriteStrategy;
import com.ryuqq.statekeeper.core.strategy.standard.StandardDurableWriteStrategy;
import com.ryuqq.statekeeper.core.strategy.standard.StandardInitialStateStrategy;
import com.ryuqq.statekeeper.core.strategy.standard.StandardReadStateStrategy;

/**
 * 상태 필드 읽기/쓰기 조정자.
 *
 * <p>외부 FSM 엔진이 결정한 target 상태를 Record에 어떻게 반영할지만 담당합니다.
 * 어떤 상태로 전이할지는 결정하지 않습니다. 자체 상태를 가지지 않으며,
 * 모든 상태는 호출마다 전달되는 Record에 있습니다.</p>
 *
 * <p><strong>연산:</strong></p>
 * <ul>
 *   <li>{@link #currentState(Record)}: 현재 상태 (매번 다시 읽음)</li>
 *   <li>{@link #ensureInitialState(Record, InitialStateSupplier)}: 검증 직전 초기 상태 보장</li>
 *   <li>{@link #writeDurable(Record, State, Store)}: 기록 + 저장, 거부 시 롤백</li>
 *   <li>{@link #writeDeferred(Record, State)}: 메모리에만 기록</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * StateCoordinator coordinator = StateCoordinator.builder(CoordinatorConfig.forField("state"))
 *     .durableWrite(customStrategy)   // 선택: 개별 연산만 교체
 *     .build();
 *
 * // "hard" 이벤트 (close!)
 * WriteOutcome outcome = coordinator.writeDurable(order, State.of("closed"), store);
 * if (outcome.isCommitted()) {
 *     // after 콜백 실행
 * }
 *
 * // "soft" 이벤트 (close)
 * coordinator.writeDeferred(order, State.of("closed"));
 * </pre>
 *
 * <p><strong>Thread Safety:</strong> 조정자는 공유 가능합니다. 같은 Record에 대한
 * 동시 호출은 호출자가 직렬화해야 합니다.</p>
 *
 * @author Statekeeper Team
 * @since 1.0.0
 */
public final class StateCoordinator {

    private final CoordinatorConfig config;
    private final ReadStateStrategy readStrategy;
    private final InitialStateStrategy initialStateStrategy;
    private final DurableWriteStrategy durableWriteStrategy;
    private final DeferredWriteStrategy deferredWriteStrategy;

    private StateCoordinator(Builder builder) {
        this.config = builder.config;
        this.readStrategy = builder.readStrategy != null
            ? builder.readStrategy
            : new StandardReadStateStrategy();
        this.initialStateStrategy = builder.initialStateStrategy != null
            ? builder.initialStateStrategy
            : new StandardInitialStateStrategy();
        this.durableWriteStrategy = builder.durableWriteStrategy != null
            ? builder.durableWriteStrategy
            : new StandardDurableWriteStrategy(config.faultPolicy());
        this.deferredWriteStrategy = builder.deferredWriteStrategy != null
            ? builder.deferredWriteStrategy
            : new StandardDeferredWriteStrategy();
    }

    /**
     * 기본 전략으로 조정자 생성.
     *
     * @param config 설정
     * @return StateCoordinator 인스턴스
     * @throws IllegalArgumentException config가 null인 경우
     */
    public static StateCoordinator create(CoordinatorConfig config) {
        return builder(config).build();
    }

    /**
     * Builder 생성.
     *
     * @param config 설정
     * @return Builder
     * @throws IllegalArgumentException config가 null인 경우
     */
    public static Builder builder(CoordinatorConfig config) {
        return new Builder(config);
    }

    /**
     * 현재 상태 조회.
     *
     * <p>매 호출마다 Record에서 다시 읽습니다. 스냅샷이 필요하면 호출자가 반환값을 보관해야 합니다.</p>
     *
     * @param record 대상 Record
     * @return 현재 상태 (미설정인 경우 {@link State#BLANK})
     * @throws IllegalArgumentException record가 null인 경우
     */
    public State currentState(Record record) {
        return readStrategy.read(record, config.stateField());
    }

    /**
     * 현재 상태 필드의 raw 값 조회.
     *
     * @param record 대상 Record
     * @return raw 값 (미설정인 경우 null)
     * @throws IllegalArgumentException record가 null인 경우
     */
    public Object rawState(Record record) {
        return readStrategy.readRaw(record, config.stateField());
    }

    /**
     * 상태 필드가 blank인 경우에만 초기 상태 기록.
     *
     * <p>검증 단계 직전, 검증 시도마다 호출되어야 합니다. 저장소에는 접근하지 않습니다.</p>
     *
     * @param record 대상 Record
     * @param supplier 초기 상태 공급자
     * @return 초기 상태를 기록한 경우 true
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public boolean ensureInitialState(Record record, InitialStateSupplier supplier) {
        return initialStateStrategy.ensureInitialState(record, config.stateField(), supplier);
    }

    /**
     * 상태 기록 후 즉시 저장.
     *
     * <p>저장 거부는 예외가 아니라 {@link com.ryuqq.statekeeper.core.outcome.RolledBack}으로 보고됩니다.
     * 저장소 장애(그 외 RuntimeException)는 {@link CoordinatorConfig#faultPolicy()}에 따라 전파됩니다.</p>
     *
     * @param record 대상 Record
     * @param target 요청된 상태
     * @param store 저장소
     * @return Committed 또는 RolledBack
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public WriteOutcome writeDurable(Record record, State target, Store store) {
        return durableWriteStrategy.write(record, config.stateField(), target, store);
    }

    /**
     * 상태를 메모리에만 기록.
     *
     * @param record 대상 Record
     * @param target 요청된 상태
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public void writeDeferred(Record record, State target) {
        deferredWriteStrategy.write(record, config.stateField(), target);
    }

    /**
     * 상태 필드 조회.
     *
     * @return StateField
     */
    public StateField stateField() {
        return config.stateField();
    }

    /**
     * 설정 조회.
     *
     * @return CoordinatorConfig
     */
    public CoordinatorConfig config() {
        return config;
    }

    /**
     * StateCoordinator Builder.
     *
     * <p>지정하지 않은 전략은 {@code core.strategy.standard}의 기본 구현을 사용합니다.</p>
     */
    public static final class Builder {

        private final CoordinatorConfig config;
        private ReadStateStrategy readStrategy;
        private InitialStateStrategy initialStateStrategy;
        private DurableWriteStrategy durableWriteStrategy;
        private DeferredWriteStrategy deferredWriteStrategy;

        private Builder(CoordinatorConfig config) {
            if (config == null) {
                throw new IllegalArgumentException("config cannot be null");
            }
            this.config = config;
        }

        /**
         * 읽기 전략 교체.
         *
         * @param strategy 읽기 전략
         * @return this
         */
        public Builder read(ReadStateStrategy strategy) {
            this.readStrategy = requireStrategy(strategy);
            return this;
        }

        /**
         * 초기 상태 전략 교체.
         *
         * @param strategy 초기 상태 전략
         * @return this
         */
        public Builder initialState(InitialStateStrategy strategy) {
            this.initialStateStrategy = requireStrategy(strategy);
            return this;
        }

        /**
         * 즉시 저장 전략 교체.
         *
         * @param strategy 즉시 저장 전략
         * @return this
         */
        public Builder durableWrite(DurableWriteStrategy strategy) {
            this.durableWriteStrategy = requireStrategy(strategy);
            return this;
        }

        /**
         * 지연 저장 전략 교체.
         *
         * @param strategy 지연 저장 전략
         * @return this
         */
        public Builder deferredWrite(DeferredWriteStrategy strategy) {
            this.deferredWriteStrategy = requireStrategy(strategy);
            return this;
        }

        /**
         * StateCoordinator 생성.
         *
         * @return StateCoordinator 인스턴스
         */
        public StateCoordinator build() {
            return new StateCoordinator(this);
        }

        private static <T> T requireStrategy(T strategy) {
            if (strategy == null) {
                throw new IllegalArgumentException("strategy cannot be null");
            }
            return strategy;
        }
    }
}
