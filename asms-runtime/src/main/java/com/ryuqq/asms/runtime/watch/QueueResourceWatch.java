package com.ryuqq.asms.runtime.watch;

import com.ryuqq.asms.core.contract.ResourceUpdate;
import com.ryuqq.asms.core.contract.ResourceWatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded 큐 기반 {@link ResourceWatch}.
 *
 * <p>생산자는 {@link #offer(ResourceUpdate)}로 블로킹 없이 전달하며, 버퍼가 가득 차면
 * 알림을 버리고 경고를 남깁니다. 종료 후에도 버퍼에 남은 알림은 poll할 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class QueueResourceWatch implements ResourceWatch {

    private static final Logger log = LoggerFactory.getLogger(QueueResourceWatch.class);

    private final String uri;
    private final BlockingQueue<ResourceUpdate> buffer;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong dropped = new AtomicLong();
    private final List<Runnable> closeHooks = new CopyOnWriteArrayList<>();

    public QueueResourceWatch(String uri, int capacity) {
        if (uri == null || uri.isBlank()) {
            throw new IllegalArgumentException("uri cannot be null or blank");
        }
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive (current: " + capacity + ")");
        }
        this.uri = uri;
        this.buffer = new ArrayBlockingQueue<>(capacity);
    }

    /**
     * 블로킹 없이 알림 전달.
     *
     * @param update 알림
     * @return 버퍼에 들어갔으면 true, 종료되었거나 가득 차서 버렸으면 false
     */
    public boolean offer(ResourceUpdate update) {
        if (closed.get()) {
            return false;
        }
        if (buffer.offer(update)) {
            return true;
        }
        long count = dropped.incrementAndGet();
        log.warn("Watch buffer full for {}, dropped {} update (total dropped: {})", uri, update.operation(), count);
        return false;
    }

    @Override
    public ResourceUpdate poll(long timeout, TimeUnit unit) throws InterruptedException {
        if (closed.get()) {
            return buffer.poll();
        }
        return buffer.poll(timeout, unit);
    }

    @Override
    public boolean isClosed() {
        return closed.get() && buffer.isEmpty();
    }

    /**
     * 구독 종료.
     *
     * @return 이번 호출로 종료되었으면 true
     */
    @Override
    public boolean cancel() {
        if (!closed.compareAndSet(false, true)) {
            return false;
        }
        for (Runnable hook : closeHooks) {
            if (!closeHooks.remove(hook)) {
                continue;
            }
            try {
                hook.run();
            } catch (RuntimeException e) {
                log.warn("Watch close hook failed for {}", uri, e);
            }
        }
        log.debug("Watch closed for {}", uri);
        return true;
    }

    /**
     * 종료 시 실행할 정리 작업 등록.
     *
     * <p>이미 종료된 경우 즉시 실행합니다.</p>
     */
    public void onClose(Runnable hook) {
        closeHooks.add(hook);
        if (closed.get() && closeHooks.remove(hook)) {
            hook.run();
        }
    }

    public String getUri() {
        return uri;
    }

    public long getDroppedCount() {
        return dropped.get();
    }

    public int size() {
        return buffer.size();
    }
}
