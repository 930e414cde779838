package com.ryuqq.asms.runtime.watch;

import com.ryuqq.asms.core.context.Cancellable;
import com.ryuqq.asms.core.context.CallContext;
import com.ryuqq.asms.core.contract.ResourceUpdate;
import com.ryuqq.asms.core.contract.ResourceWatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * 하나의 poll 작업을 여러 구독자에게 fan-out 하는 watcher 목록.
 *
 * <p><strong>동작:</strong></p>
 * <ul>
 *   <li>첫 구독 시 공유 poll 작업 시작, 마지막 구독 해제 시 중단</li>
 *   <li>각 구독자는 독립된 버퍼를 가짐 (느린 구독자는 자신의 알림만 잃음)</li>
 *   <li>구독/해제/fan-out은 모두 같은 mutex 아래에서 수행</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class WatcherList {

    private static final Logger log = LoggerFactory.getLogger(WatcherList.class);

    private final Object mutex = new Object();
    private final List<QueueResourceWatch> watchers = new ArrayList<>();

    private final ResourcePoller poller;
    private final String uri;
    private final long intervalMs;
    private final int capacity;
    private final ResourceFetcher fetcher;
    private final Supplier<ChangeDetector> detectorFactory;

    private Cancellable polling;

    /**
     * 생성자.
     *
     * @param poller poll 런타임
     * @param uri Resource URI
     * @param intervalMs poll 주기
     * @param capacity 구독자별 버퍼 크기
     * @param fetcher 값 조회 함수
     * @param detectorFactory 공유 poll 작업마다 새 감지기를 만드는 팩토리
     */
    public WatcherList(
        ResourcePoller poller,
        String uri,
        long intervalMs,
        int capacity,
        ResourceFetcher fetcher,
        Supplier<ChangeDetector> detectorFactory
    ) {
        if (poller == null) {
            throw new IllegalArgumentException("poller cannot be null");
        }
        if (fetcher == null) {
            throw new IllegalArgumentException("fetcher cannot be null");
        }
        if (detectorFactory == null) {
            throw new IllegalArgumentException("detectorFactory cannot be null");
        }
        this.poller = poller;
        this.uri = uri;
        this.intervalMs = intervalMs;
        this.capacity = capacity;
        this.fetcher = fetcher;
        this.detectorFactory = detectorFactory;
    }

    /**
     * 구독 추가.
     *
     * @param ctx 구독 컨텍스트 (종료 시 이 구독만 해제)
     * @return watch 핸들
     */
    public ResourceWatch subscribe(CallContext ctx) {
        QueueResourceWatch watch = new QueueResourceWatch(uri, capacity);
        synchronized (mutex) {
            watchers.add(watch);
            if (polling == null) {
                polling = poller.schedule(
                    CallContext.background(), uri, intervalMs, fetcher, detectorFactory.get(), this::broadcast
                );
            }
        }
        watch.onClose(() -> unsubscribe(watch));
        Cancellable registration = ctx.onDone(watch::cancel);
        watch.onClose(registration::cancel);
        log.debug("Subscribed to {} ({} watchers)", uri, size());
        return watch;
    }

    /**
     * 모든 구독자에게 알림 전달 (non-blocking).
     *
     * @param update 알림
     */
    public void broadcast(ResourceUpdate update) {
        synchronized (mutex) {
            for (QueueResourceWatch watch : watchers) {
                watch.offer(update);
            }
        }
    }

    public int size() {
        synchronized (mutex) {
            return watchers.size();
        }
    }

    private void unsubscribe(QueueResourceWatch watch) {
        Cancellable toStop = null;
        synchronized (mutex) {
            watchers.remove(watch);
            if (watchers.isEmpty() && polling != null) {
                toStop = polling;
                polling = null;
            }
        }
        if (toStop != null) {
            toStop.cancel();
        }
        log.debug("Unsubscribed from {} ({} watchers)", uri, size());
    }
}
