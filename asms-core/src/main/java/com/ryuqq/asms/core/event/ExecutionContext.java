package com.ryuqq.asms.core.event;

import com.ryuqq.asms.core.error.UnitException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 단일 Unit 실행의 이벤트 발행 헬퍼.
 *
 * <p><strong>발행 규칙:</strong></p>
 * <ul>
 *   <li>{@link #publishStarted(Object)}: 비즈니스 전제조건 검증 전에 발행</li>
 *   <li>{@link #publishCompleted(Object)}: 성공 시 반환 직전에 발행</li>
 *   <li>{@link #publishFailed(Throwable)}: 모든 에러 경로에서 발행</li>
 *   <li>Started는 종료 이벤트보다 먼저 발행되며, 종료 이벤트는 정확히 하나</li>
 * </ul>
 *
 * <p>publisher가 던지는 예외는 로그만 남기고 실행을 계속합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ExecutionContext {

    private static final Logger log = LoggerFactory.getLogger(ExecutionContext.class);

    private enum Phase { NEW, STARTED, TERMINATED }

    private final EventPublisher publisher;
    private final String domain;
    private final String unitName;
    private final Clock clock;
    private final String executionId;
    private final AtomicReference<Phase> phase = new AtomicReference<>(Phase.NEW);
    private volatile Instant startedAt;

    /**
     * 생성자.
     *
     * @param publisher 이벤트 publisher (nullable, null이면 버림)
     * @param domain 도메인
     * @param unitName Unit 이름
     * @param clock 시각 기준
     * @throws IllegalArgumentException clock이 null인 경우
     */
    public ExecutionContext(EventPublisher publisher, String domain, String unitName, Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.publisher = EventPublisher.orNoop(publisher);
        this.domain = domain;
        this.unitName = unitName;
        this.clock = clock;
        this.executionId = UUID.randomUUID().toString();
    }

    public static ExecutionContext of(EventPublisher publisher, String domain, String unitName) {
        return new ExecutionContext(publisher, domain, unitName, Clock.systemUTC());
    }

    /**
     * 실행 시작 이벤트 발행.
     *
     * @param input 실행 입력
     */
    public void publishStarted(Object input) {
        Instant now = clock.instant();
        if (!phase.compareAndSet(Phase.NEW, Phase.STARTED)) {
            log.debug("{} already started, ignoring duplicate publishStarted", unitName);
            return;
        }
        startedAt = now;
        emit(new ExecutionEvent(
            ExecutionEventType.STARTED, domain, unitName, input, null, null, null,
            now, newCorrelationId(), executionId, null
        ));
    }

    /**
     * 실행 완료 이벤트 발행.
     *
     * @param output 실행 출력
     * @throws IllegalStateException publishStarted 전에 호출된 경우
     */
    public void publishCompleted(Object output) {
        Instant now = clock.instant();
        if (!terminate()) {
            return;
        }
        emit(new ExecutionEvent(
            ExecutionEventType.COMPLETED, domain, unitName, null, output, null, null,
            now, newCorrelationId(), executionId, durationUntil(now)
        ));
    }

    /**
     * 실행 실패 이벤트 발행.
     *
     * @param error 실패 원인
     * @throws IllegalStateException publishStarted 전에 호출된 경우
     */
    public void publishFailed(Throwable error) {
        Instant now = clock.instant();
        if (!terminate()) {
            return;
        }
        String message = error != null ? error.getMessage() : null;
        String code = UnitException.find(error).map(e -> e.getCode().getValue()).orElse(null);
        emit(new ExecutionEvent(
            ExecutionEventType.FAILED, domain, unitName, null, null, message, code,
            now, newCorrelationId(), executionId, durationUntil(now)
        ));
    }

    public String getExecutionId() {
        return executionId;
    }

    public boolean isTerminated() {
        return phase.get() == Phase.TERMINATED;
    }

    private boolean terminate() {
        if (phase.get() == Phase.NEW) {
            throw new IllegalStateException("publishStarted must precede terminal event for " + unitName);
        }
        if (!phase.compareAndSet(Phase.STARTED, Phase.TERMINATED)) {
            log.warn("{} already emitted a terminal event, ignoring", unitName);
            return false;
        }
        return true;
    }

    private long durationUntil(Instant now) {
        return Math.max(0, now.toEpochMilli() - startedAt.toEpochMilli());
    }

    private void emit(ExecutionEvent event) {
        try {
            publisher.publish(event);
        } catch (RuntimeException e) {
            log.warn("Event publisher failed for {} {}", event.type(), unitName, e);
        }
    }

    private static String newCorrelationId() {
        return UUID.randomUUID().toString();
    }
}
