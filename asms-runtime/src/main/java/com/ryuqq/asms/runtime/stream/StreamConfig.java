package com.ryuqq.asms.runtime.stream;

/**
 * 스트림 브리지 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>providerBufferCapacity: provider와 브리지 사이 내부 버퍼 크기 (기본 10)</li>
 *   <li>pollIntervalMs: 취소 확인 주기 (기본 10ms)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param providerBufferCapacity 내부 버퍼 크기 (양수)
 * @param pollIntervalMs 취소 확인 주기 (양수)
 */
public record StreamConfig(int providerBufferCapacity, long pollIntervalMs) {

    public StreamConfig() {
        this(10, 10);
    }

    public StreamConfig {
        if (providerBufferCapacity <= 0) {
            throw new IllegalArgumentException(
                "providerBufferCapacity must be positive (current: " + providerBufferCapacity + ")"
            );
        }
        if (pollIntervalMs <= 0) {
            throw new IllegalArgumentException("pollIntervalMs must be positive (current: " + pollIntervalMs + ")");
        }
    }

    public StreamConfig withProviderBufferCapacity(int providerBufferCapacity) {
        return new StreamConfig(providerBufferCapacity, pollIntervalMs);
    }

    public StreamConfig withPollIntervalMs(long pollIntervalMs) {
        return new StreamConfig(providerBufferCapacity, pollIntervalMs);
    }
}
