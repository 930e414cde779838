package com.ryuqq.asms.runtime.watch;

import com.ryuqq.asms.core.context.Cancellable;
import com.ryuqq.asms.core.context.CallContext;
import com.ryuqq.asms.core.context.ContextCancelledException;
import com.ryuqq.asms.core.contract.ResourceOperation;
import com.ryuqq.asms.core.contract.ResourceUpdate;
import com.ryuqq.asms.core.contract.ResourceWatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * 주기적 poll 기반 Resource watch 런타임.
 *
 * <p><strong>tick 처리:</strong></p>
 * <ol>
 *   <li>컨텍스트가 종료되었으면 아무것도 하지 않음</li>
 *   <li>fetcher 호출 실패 시 {@code operation=error} 알림 후 다음 tick 계속</li>
 *   <li>성공 시 {@link ChangeDetector}가 결정한 종류로 알림</li>
 * </ol>
 *
 * <p>전달은 non-blocking이며, 느린 구독자의 알림은 버려집니다. 스케줄러 스레드는 데몬입니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ResourceWatch watch = poller.watch(ctx, "asms://alerts/active", 5000, store::active,
 *     ChangeDetector.always(ResourceOperation.UPDATE), 10);
 * ResourceUpdate update = watch.poll(10, TimeUnit.SECONDS);
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ResourcePoller {

    private static final Logger log = LoggerFactory.getLogger(ResourcePoller.class);

    private static final AtomicInteger POOL_SEQUENCE = new AtomicInteger();

    private final ScheduledExecutorService scheduler;
    private final Clock clock;

    public ResourcePoller() {
        this(2, Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param threads 스케줄러 스레드 수 (양수)
     * @param clock 알림 timestamp 기준
     */
    public ResourcePoller(int threads, Clock clock) {
        if (threads <= 0) {
            throw new IllegalArgumentException("threads must be positive (current: " + threads + ")");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.scheduler = Executors.newScheduledThreadPool(threads, daemonFactory());
        this.clock = clock;
    }

    /**
     * 구독자 전용 버퍼를 가진 watch 시작.
     *
     * @param ctx 구독 컨텍스트 (종료 시 watch 종료)
     * @param uri Resource URI
     * @param intervalMs poll 주기
     * @param fetcher 값 조회 함수
     * @param detector 변화 감지기 (구독마다 새 인스턴스)
     * @param capacity 버퍼 크기
     * @return watch 핸들
     */
    public ResourceWatch watch(
        CallContext ctx,
        String uri,
        long intervalMs,
        ResourceFetcher fetcher,
        ChangeDetector detector,
        int capacity
    ) {
        QueueResourceWatch watch = new QueueResourceWatch(uri, capacity);
        Cancellable polling = schedule(ctx, uri, intervalMs, fetcher, detector, watch::offer);
        watch.onClose(polling::cancel);
        Cancellable registration = ctx.onDone(watch::cancel);
        watch.onClose(registration::cancel);
        return watch;
    }

    /**
     * 임의의 sink로 전달하는 poll 작업 등록.
     *
     * @param ctx 작업 컨텍스트 (종료 시 작업 중단)
     * @param uri Resource URI
     * @param intervalMs poll 주기 (양수)
     * @param fetcher 값 조회 함수
     * @param detector 변화 감지기
     * @param sink 알림 수신자 (블로킹하지 않아야 함)
     * @return 작업 중단 핸들
     */
    public Cancellable schedule(
        CallContext ctx,
        String uri,
        long intervalMs,
        ResourceFetcher fetcher,
        ChangeDetector detector,
        Consumer<ResourceUpdate> sink
    ) {
        if (ctx == null) {
            throw new IllegalArgumentException("ctx cannot be null");
        }
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("intervalMs must be positive (current: " + intervalMs + ")");
        }
        if (fetcher == null || detector == null || sink == null) {
            throw new IllegalArgumentException("fetcher, detector and sink cannot be null");
        }

        CallContext pollCtx = ctx.withCancel();
        ScheduledFuture<?> future = scheduler.scheduleAtFixedRate(
            () -> tick(pollCtx, uri, fetcher, detector, sink),
            intervalMs,
            intervalMs,
            TimeUnit.MILLISECONDS
        );
        pollCtx.onDone(() -> {
            future.cancel(false);
            log.info("Watch stopped for {}", uri);
        });
        log.info("Watch started for {} (interval: {}ms)", uri, intervalMs);
        return pollCtx::cancel;
    }

    private void tick(
        CallContext ctx,
        String uri,
        ResourceFetcher fetcher,
        ChangeDetector detector,
        Consumer<ResourceUpdate> sink
    ) {
        if (ctx.isDone()) {
            return;
        }
        ResourceUpdate update;
        try {
            Object data = fetcher.fetch(ctx);
            ResourceOperation operation = detector.detect(data);
            update = ResourceUpdate.of(uri, clock.instant(), operation, data);
        } catch (ContextCancelledException e) {
            return;
        } catch (RuntimeException e) {
            log.warn("Watch tick failed for {}: {}", uri, e.getMessage());
            update = ResourceUpdate.error(uri, clock.instant(), e);
        }
        if (ctx.isDone()) {
            return;
        }
        try {
            sink.accept(update);
            log.debug("Watch tick {} for {}", update.operation(), uri);
        } catch (RuntimeException e) {
            log.error("Watch sink failed for {}", uri, e);
        }
    }

    /**
     * 스케줄러 종료.
     *
     * @throws InterruptedException 대기 중 인터럽트
     */
    public void shutdown() throws InterruptedException {
        scheduler.shutdown();
        if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
            scheduler.shutdownNow();
        }
    }

    private static ThreadFactory daemonFactory() {
        int pool = POOL_SEQUENCE.incrementAndGet();
        AtomicInteger sequence = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "asms-watch-" + pool + "-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
