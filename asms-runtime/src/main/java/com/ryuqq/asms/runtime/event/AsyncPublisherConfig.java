package com.ryuqq.asms.runtime.event;

/**
 * AsyncEventPublisher 설정 (불변 record).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param queueCapacity 대기 큐 크기 (기본 1024)
 * @param shutdownTimeoutMs 종료 시 남은 이벤트 처리 대기 시간 (기본 5000)
 */
public record AsyncPublisherConfig(int queueCapacity, long shutdownTimeoutMs) {

    public AsyncPublisherConfig() {
        this(1024, 5000);
    }

    public AsyncPublisherConfig {
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException("queueCapacity must be positive (current: " + queueCapacity + ")");
        }
        if (shutdownTimeoutMs < 0) {
            throw new IllegalArgumentException(
                "shutdownTimeoutMs must be non-negative (current: " + shutdownTimeoutMs + ")"
            );
        }
    }

    public AsyncPublisherConfig withQueueCapacity(int queueCapacity) {
        return new AsyncPublisherConfig(queueCapacity, shutdownTimeoutMs);
    }

    public AsyncPublisherConfig withShutdownTimeoutMs(long shutdownTimeoutMs) {
        return new AsyncPublisherConfig(queueCapacity, shutdownTimeoutMs);
    }
}
