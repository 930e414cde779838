package com.ryuqq.asms.runtime.event;

import com.ryuqq.asms.core.event.Event;
import com.ryuqq.asms.core.event.EventPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 백그라운드 스레드 하나로 delegate에 전달하는 publisher.
 *
 * <p><strong>특징:</strong></p>
 * <ul>
 *   <li>{@link #publish(Event)}는 블로킹하지 않음 (큐가 가득 차면 버리고 경고)</li>
 *   <li>delegate 예외는 로그만 남기고 다음 이벤트 계속 처리</li>
 *   <li>한 publisher 내에서 발행 순서 유지</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class AsyncEventPublisher implements EventPublisher, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AsyncEventPublisher.class);

    private final EventPublisher delegate;
    private final AsyncPublisherConfig config;
    private final BlockingQueue<Event> queue;
    private final ExecutorService dispatcher;
    private final AtomicBoolean running = new AtomicBoolean(true);
    private final AtomicLong dropped = new AtomicLong();

    public AsyncEventPublisher(EventPublisher delegate) {
        this(delegate, new AsyncPublisherConfig());
    }

    public AsyncEventPublisher(EventPublisher delegate, AsyncPublisherConfig config) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.delegate = delegate;
        this.config = config;
        this.queue = new ArrayBlockingQueue<>(config.queueCapacity());
        this.dispatcher = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "asms-event-publisher");
            thread.setDaemon(true);
            return thread;
        });
        this.dispatcher.execute(this::drainLoop);
    }

    @Override
    public void publish(Event event) {
        if (event == null) {
            return;
        }
        if (!running.get() || !queue.offer(event)) {
            long count = dropped.incrementAndGet();
            log.warn("Event dropped: type={} correlationId={} (total dropped: {})",
                event.type(), event.correlationId(), count);
        }
    }

    public long getDroppedCount() {
        return dropped.get();
    }

    public int pending() {
        return queue.size();
    }

    /**
     * 새 이벤트 수신을 중단하고 남은 이벤트를 최대 shutdownTimeoutMs 동안 처리.
     */
    @Override
    public void close() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        dispatcher.shutdown();
        try {
            if (!dispatcher.awaitTermination(config.shutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
                log.warn("Event publisher shutdown timed out with {} pending events", queue.size());
                dispatcher.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            dispatcher.shutdownNow();
        }
    }

    private void drainLoop() {
        while (running.get() || !queue.isEmpty()) {
            Event event;
            try {
                event = queue.poll(50, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (event == null) {
                continue;
            }
            try {
                delegate.publish(event);
            } catch (RuntimeException e) {
                log.error("Event delegate failed for type={} correlationId={}", event.type(), event.correlationId(), e);
            }
        }
    }
}
