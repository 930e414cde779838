package com.ryuqq.asms.runtime.watch;

/**
 * Resource watch 설정 (불변 record).
 *
 * <p><strong>설정 항목 (밀리초):</strong></p>
 * <ul>
 *   <li>rulesIntervalMs: 알림 규칙 (기본 30000)</li>
 *   <li>activeAlertsIntervalMs: 활성 알림 (기본 5000)</li>
 *   <li>deviceInfoIntervalMs: 디바이스 정보 (기본 30000)</li>
 *   <li>deviceMetricsIntervalMs: 디바이스 메트릭 (기본 5000)</li>
 *   <li>deviceHealthIntervalMs: 디바이스 헬스 (기본 10000)</li>
 *   <li>inferenceModelsIntervalMs: 추론 모델 목록 (기본 60000)</li>
 *   <li>serviceIntervalMs: 단일 서비스 (기본 30000)</li>
 *   <li>servicesListIntervalMs: 서비스 목록 (기본 60000)</li>
 *   <li>bufferCapacity: 구독자별 버퍼 크기 (기본 10)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param rulesIntervalMs 알림 규칙 주기
 * @param activeAlertsIntervalMs 활성 알림 주기
 * @param deviceInfoIntervalMs 디바이스 정보 주기
 * @param deviceMetricsIntervalMs 디바이스 메트릭 주기
 * @param deviceHealthIntervalMs 디바이스 헬스 주기
 * @param inferenceModelsIntervalMs 추론 모델 주기
 * @param serviceIntervalMs 단일 서비스 주기
 * @param servicesListIntervalMs 서비스 목록 주기
 * @param bufferCapacity 버퍼 크기 (10 이상)
 */
public record WatchConfig(
    long rulesIntervalMs,
    long activeAlertsIntervalMs,
    long deviceInfoIntervalMs,
    long deviceMetricsIntervalMs,
    long deviceHealthIntervalMs,
    long inferenceModelsIntervalMs,
    long serviceIntervalMs,
    long servicesListIntervalMs,
    int bufferCapacity
) {

    public static final int MIN_BUFFER_CAPACITY = 10;

    /**
     * 기본 설정 생성자.
     */
    public WatchConfig() {
        this(30000, 5000, 30000, 5000, 10000, 60000, 30000, 60000, MIN_BUFFER_CAPACITY);
    }

    public WatchConfig {
        requirePositive("rulesIntervalMs", rulesIntervalMs);
        requirePositive("activeAlertsIntervalMs", activeAlertsIntervalMs);
        requirePositive("deviceInfoIntervalMs", deviceInfoIntervalMs);
        requirePositive("deviceMetricsIntervalMs", deviceMetricsIntervalMs);
        requirePositive("deviceHealthIntervalMs", deviceHealthIntervalMs);
        requirePositive("inferenceModelsIntervalMs", inferenceModelsIntervalMs);
        requirePositive("serviceIntervalMs", serviceIntervalMs);
        requirePositive("servicesListIntervalMs", servicesListIntervalMs);
        if (bufferCapacity < MIN_BUFFER_CAPACITY) {
            throw new IllegalArgumentException(
                "bufferCapacity must be at least " + MIN_BUFFER_CAPACITY + " (current: " + bufferCapacity + ")"
            );
        }
    }

    /**
     * 모든 주기를 같은 값으로 설정 (테스트용).
     *
     * @param intervalMs 주기
     * @return WatchConfig
     */
    public static WatchConfig uniform(long intervalMs) {
        return new WatchConfig(intervalMs, intervalMs, intervalMs, intervalMs, intervalMs, intervalMs, intervalMs,
            intervalMs, MIN_BUFFER_CAPACITY);
    }

    public WatchConfig withRulesIntervalMs(long value) {
        return new WatchConfig(value, activeAlertsIntervalMs, deviceInfoIntervalMs, deviceMetricsIntervalMs,
            deviceHealthIntervalMs, inferenceModelsIntervalMs, serviceIntervalMs, servicesListIntervalMs, bufferCapacity);
    }

    public WatchConfig withActiveAlertsIntervalMs(long value) {
        return new WatchConfig(rulesIntervalMs, value, deviceInfoIntervalMs, deviceMetricsIntervalMs,
            deviceHealthIntervalMs, inferenceModelsIntervalMs, serviceIntervalMs, servicesListIntervalMs, bufferCapacity);
    }

    public WatchConfig withDeviceHealthIntervalMs(long value) {
        return new WatchConfig(rulesIntervalMs, activeAlertsIntervalMs, deviceInfoIntervalMs, deviceMetricsIntervalMs,
            value, inferenceModelsIntervalMs, serviceIntervalMs, servicesListIntervalMs, bufferCapacity);
    }

    public WatchConfig withServiceIntervalMs(long value) {
        return new WatchConfig(rulesIntervalMs, activeAlertsIntervalMs, deviceInfoIntervalMs, deviceMetricsIntervalMs,
            deviceHealthIntervalMs, inferenceModelsIntervalMs, value, servicesListIntervalMs, bufferCapacity);
    }

    /**
     * bufferCapacity만 변경한 새 인스턴스 생성.
     */
    public WatchConfig withBufferCapacity(int value) {
        return new WatchConfig(rulesIntervalMs, activeAlertsIntervalMs, deviceInfoIntervalMs, deviceMetricsIntervalMs,
            deviceHealthIntervalMs, inferenceModelsIntervalMs, serviceIntervalMs, servicesListIntervalMs, value);
    }

    private static void requirePositive(String name, long value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive (current: " + value + ")");
        }
    }
}
