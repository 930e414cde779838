package com.ryuqq.asms.domain.device;

/**
 * 실시간 장치 메트릭.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param utilization 사용률 (%)
 * @param temperature 온도 (°C)
 * @param power 전력 (W)
 * @param memoryUsed 사용 메모리 (bytes)
 * @param memoryTotal 전체 메모리 (bytes)
 */
public record DeviceMetrics(
    double utilization,
    double temperature,
    double power,
    long memoryUsed,
    long memoryTotal
) {
}
