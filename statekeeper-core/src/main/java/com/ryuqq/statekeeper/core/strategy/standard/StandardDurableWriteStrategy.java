package com.ryuqq.statekeeper.core.strategy.standard;

import com.ryuqq.statekeeper.core.config.FaultPolicy;
import com.ryuqq.statekeeper.core.model.State;
import com.ryuqq.statekeeper.core.model.StateField;
import com.ryuqq.statekeeper.core.outcome.Committed;
import com.ryuqq.statekeeper.core.outcome.RolledBack;
import com.ryuqq.statekeeper.core.outcome.WriteOutcome;
import com.ryuqq.statekeeper.core.spi.PersistOptions;
import com.ryuqq.statekeeper.core.spi.PersistenceRejectedException;
import com.ryuqq.statekeeper.core.spi.Record;
import com.ryuqq.statekeeper.core.spi.Store;
import com.ryuqq.statekeeper.core.strategy.DurableWriteStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 기본 즉시 저장 구현 (단일 필드 커밋/롤백).
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. previous = record.get(field)        (raw 값 그대로)
 * 2. record.set(field, target.value())
 * 3. store.persist(record, validate=false)
 *    a. true  → Committed(target)
 *    b. false 또는 PersistenceRejectedException
 *             → record.set(field, previous), RolledBack(previous)
 *    c. 그 외 RuntimeException
 *             → FaultPolicy에 따라 복원 여부 결정 후 그대로 전파
 * </pre>
 *
 * <p>검증을 건너뛰는 이유: 전이는 이미 FSM guard에서 승인되었으며,
 * 상태와 무관한 필드 오류로 정상 전이가 막히면 안 됩니다.</p>
 *
 * <p>단일 필드에 대한 best-effort 롤백만 제공합니다. 다중 필드 트랜잭션이나
 * 동시 쓰기 보호는 제공하지 않습니다.</p>
 *
 * @author Statekeeper Team
 * @since 1.0.0
 */
public final class StandardDurableWriteStrategy implements DurableWriteStrategy {

    private static final Logger log = LoggerFactory.getLogger(StandardDurableWriteStrategy.class);

    private final FaultPolicy faultPolicy;

    /**
     * 기본 생성자 (FaultPolicy.PROPAGATE).
     */
    public StandardDurableWriteStrategy() {
        this(FaultPolicy.PROPAGATE);
    }

    /**
     * 생성자.
     *
     * @param faultPolicy 저장소 장애 정책
     * @throws IllegalArgumentException faultPolicy가 null인 경우
     */
    public StandardDurableWriteStrategy(FaultPolicy faultPolicy) {
        if (faultPolicy == null) {
            throw new IllegalArgumentException("faultPolicy cannot be null");
        }
        this.faultPolicy = faultPolicy;
    }

    @Override
    public WriteOutcome write(Record record, StateField field, State target, Store store) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        if (field == null) {
            throw new IllegalArgumentException("field cannot be null");
        }
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }

        String fieldName = field.getName();

        // 1. 이전 raw 값 보관
        Object previous = record.get(fieldName);

        // 2. target 기록
        record.set(fieldName, target.value());

        // 3. 저장 (검증 생략)
        boolean persisted;
        try {
            persisted = store.persist(record, PersistOptions.skipValidation());
        } catch (PersistenceRejectedException e) {
            log.debug("Store rejected record {} by exception: {}", record.id(), e.getMessage());
            persisted = false;
        } catch (RuntimeException e) {
            if (faultPolicy.restoresBeforePropagating()) {
                record.set(fieldName, previous);
            }
            log.warn("Store fault while persisting record {} ({}: {} → {}), policy {}",
                record.id(), fieldName, previous, target, faultPolicy, e);
            throw e;
        }

        if (!persisted) {
            record.set(fieldName, previous);
            log.info("State write rolled back for record {}: {} rejected, restored {}",
                record.id(), target, previous);
            return new RolledBack(previous, target);
        }

        log.debug("State write committed for record {}: {} → {}", record.id(), previous, target);
        return Committed.of(target);
    }

    /**
     * 장애 정책 조회.
     *
     * @return FaultPolicy
     */
    public FaultPolicy getFaultPolicy() {
        return faultPolicy;
    }
}
