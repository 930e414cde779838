package com.ryuqq.asms.core.context;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 호출 단위 취소 토큰 및 요청 메타데이터.
 *
 * <p>모든 경계 호출(Unit 실행, Store, Provider, 스트림, Watch)은 CallContext를 받고
 * 블로킹 지점마다 취소 여부를 확인해야 합니다.</p>
 *
 * <p><strong>트리 구조:</strong></p>
 * <ul>
 *   <li>{@link #background()}: 루트, 절대 종료되지 않음</li>
 *   <li>{@link #withCancel()}, {@link #withTimeout(Duration)}, {@link #withDeadline(Instant)}: 자식 생성</li>
 *   <li>부모가 종료되면 자식도 같은 예외 인스턴스로 종료됨</li>
 *   <li>자식 종료는 부모에 영향 없음</li>
 * </ul>
 *
 * <p><strong>종료 예외:</strong></p>
 * <ul>
 *   <li>종료 시 {@link ContextCancelledException} 하나가 생성되고 {@link #err()}는 항상 그 인스턴스를 반환</li>
 *   <li>취소: reason=CANCELED, 데드라인 초과: reason=DEADLINE_EXCEEDED</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * CallContext ctx = CallContext.background().withTimeout(Duration.ofSeconds(30));
 * try {
 *     command.executeStream(ctx, input, outbound);
 * } catch (ContextCancelledException e) {
 *     // e == ctx.err()
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CallContext {

    private static final Logger log = LoggerFactory.getLogger(CallContext.class);

    public static final String REQUEST_ID = "request_id";
    public static final String TRACE_ID = "trace_id";
    public static final String USER_ID = "user_id";

    private static final CallContext BACKGROUND = new CallContext(null, Map.of(), null);

    private static final ScheduledExecutorService DEADLINES = Executors.newSingleThreadScheduledExecutor(runnable -> {
        Thread thread = new Thread(runnable, "asms-context-deadline");
        thread.setDaemon(true);
        return thread;
    });

    private final CallContext parent;
    private final Map<String, Object> values;
    private final Instant deadline;
    private final CountDownLatch doneLatch = new CountDownLatch(1);
    private final AtomicReference<ContextCancelledException> error = new AtomicReference<>();
    private final List<Runnable> listeners = new ArrayList<>();

    private volatile Cancellable parentRegistration;
    private volatile ScheduledFuture<?> deadlineTimer;

    private CallContext(CallContext parent, Map<String, Object> values, Instant deadline) {
        this.parent = parent;
        this.values = values;
        this.deadline = deadline;
    }

    /**
     * 종료되지 않는 루트 컨텍스트.
     *
     * @return background 컨텍스트
     */
    public static CallContext background() {
        return BACKGROUND;
    }

    /**
     * 취소 가능한 자식 컨텍스트 생성.
     *
     * @return 자식 컨텍스트
     */
    public CallContext withCancel() {
        return child(values, deadline);
    }

    /**
     * 지정된 시간 후 종료되는 자식 컨텍스트 생성.
     *
     * @param timeout 타임아웃 (양수)
     * @return 자식 컨텍스트
     * @throws IllegalArgumentException timeout이 null인 경우
     */
    public CallContext withTimeout(Duration timeout) {
        if (timeout == null) {
            throw new IllegalArgumentException("timeout cannot be null");
        }
        return withDeadline(Instant.now().plus(timeout));
    }

    /**
     * 지정된 시각에 종료되는 자식 컨텍스트 생성.
     *
     * <p>부모 데드라인이 더 이르면 부모 데드라인을 따릅니다.</p>
     *
     * @param at 데드라인
     * @return 자식 컨텍스트
     * @throws IllegalArgumentException at이 null인 경우
     */
    public CallContext withDeadline(Instant at) {
        if (at == null) {
            throw new IllegalArgumentException("deadline cannot be null");
        }
        Instant effective = deadline != null && deadline.isBefore(at) ? deadline : at;
        return child(values, effective);
    }

    /**
     * 값을 추가한 자식 컨텍스트 생성.
     *
     * @param key 키
     * @param value 값 (null이면 키 제거)
     * @return 자식 컨텍스트
     */
    public CallContext withValue(String key, Object value) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        Map<String, Object> copy = new HashMap<>(values);
        if (value == null) {
            copy.remove(key);
        } else {
            copy.put(key, value);
        }
        return child(Collections.unmodifiableMap(copy), deadline);
    }

    public CallContext withRequestId(String requestId) {
        return withValue(REQUEST_ID, requestId);
    }

    public CallContext withTraceId(String traceId) {
        return withValue(TRACE_ID, traceId);
    }

    public CallContext withUserId(String userId) {
        return withValue(USER_ID, userId);
    }

    public Optional<Object> value(String key) {
        return Optional.ofNullable(values.get(key));
    }

    public Optional<String> requestId() {
        return stringValue(REQUEST_ID);
    }

    public Optional<String> traceId() {
        return stringValue(TRACE_ID);
    }

    public Optional<String> userId() {
        return stringValue(USER_ID);
    }

    public Optional<Instant> deadline() {
        return Optional.ofNullable(deadline);
    }

    /**
     * 컨텍스트 취소.
     *
     * <p>background 컨텍스트는 취소할 수 없으며 false를 반환합니다.</p>
     *
     * @return 이번 호출로 종료되었으면 true
     */
    public boolean cancel() {
        if (this == BACKGROUND) {
            return false;
        }
        return finish(new ContextCancelledException(ContextCancelledException.Reason.CANCELED));
    }

    public boolean isDone() {
        return error.get() != null;
    }

    /**
     * 종료 예외 조회.
     *
     * @return 종료 예외, 아직 종료되지 않았으면 null
     */
    public ContextCancelledException err() {
        return error.get();
    }

    /**
     * 종료되었으면 종료 예외를 그대로 던짐.
     *
     * @throws ContextCancelledException 종료된 경우
     */
    public void throwIfDone() {
        ContextCancelledException cancelled = error.get();
        if (cancelled != null) {
            throw cancelled;
        }
    }

    /**
     * 종료될 때까지 최대 timeout 동안 대기.
     *
     * @return 종료되었으면 true
     * @throws InterruptedException 대기 중 인터럽트
     */
    public boolean awaitDone(long timeout, TimeUnit unit) throws InterruptedException {
        return doneLatch.await(timeout, unit);
    }

    /**
     * 종료 시 실행할 콜백 등록.
     *
     * <p>이미 종료된 경우 호출 스레드에서 즉시 실행합니다.</p>
     *
     * @param callback 콜백
     * @return 등록 해제 핸들
     */
    public Cancellable onDone(Runnable callback) {
        if (callback == null) {
            throw new IllegalArgumentException("callback cannot be null");
        }
        if (this == BACKGROUND) {
            return () -> false;
        }
        synchronized (listeners) {
            if (error.get() == null) {
                listeners.add(callback);
                return () -> {
                    synchronized (listeners) {
                        return listeners.remove(callback);
                    }
                };
            }
        }
        runQuietly(callback);
        return () -> false;
    }

    private CallContext child(Map<String, Object> childValues, Instant childDeadline) {
        CallContext child = new CallContext(this, childValues, childDeadline);
        child.start();
        return child;
    }

    private void start() {
        if (parent != null && parent != BACKGROUND) {
            parentRegistration = parent.onDone(() -> finish(parent.err()));
        }
        if (isDone() || deadline == null) {
            return;
        }
        long delayNanos = Duration.between(Instant.now(), deadline).toNanos();
        if (delayNanos <= 0) {
            finish(new ContextCancelledException(ContextCancelledException.Reason.DEADLINE_EXCEEDED));
            return;
        }
        deadlineTimer = DEADLINES.schedule(
            () -> finish(new ContextCancelledException(ContextCancelledException.Reason.DEADLINE_EXCEEDED)),
            delayNanos,
            TimeUnit.NANOSECONDS
        );
    }

    private boolean finish(ContextCancelledException cause) {
        if (!error.compareAndSet(null, cause)) {
            return false;
        }
        doneLatch.countDown();

        List<Runnable> snapshot;
        synchronized (listeners) {
            snapshot = new ArrayList<>(listeners);
            listeners.clear();
        }
        for (Runnable listener : snapshot) {
            runQuietly(listener);
        }

        ScheduledFuture<?> timer = deadlineTimer;
        if (timer != null) {
            timer.cancel(false);
        }
        Cancellable registration = parentRegistration;
        if (registration != null) {
            registration.cancel();
        }
        return true;
    }

    private Optional<String> stringValue(String key) {
        Object value = values.get(key);
        return value instanceof String text ? Optional.of(text) : Optional.empty();
    }

    private static void runQuietly(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warn("CallContext done callback failed", e);
        }
    }
}
