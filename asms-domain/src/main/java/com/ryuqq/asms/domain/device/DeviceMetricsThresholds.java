package com.ryuqq.asms.domain.device;

/**
 * {@code device.metrics_alert} 발행 기준값.
 *
 * <p>null 필드는 검사하지 않습니다. 값이 기준을 초과(&gt;)하면 알림 이벤트가 발행됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param temperature 온도 기준 (°C, nullable)
 * @param utilization 사용률 기준 (%, nullable)
 */
public record DeviceMetricsThresholds(Double temperature, Double utilization) {

    public static final DeviceMetricsThresholds NONE = new DeviceMetricsThresholds(null, null);

    public DeviceMetricsThresholds {
        if (temperature != null && temperature <= 0) {
            throw new IllegalArgumentException("temperature must be positive (current: " + temperature + ")");
        }
        if (utilization != null && (utilization <= 0 || utilization > 100)) {
            throw new IllegalArgumentException("utilization must be in (0, 100] (current: " + utilization + ")");
        }
    }

    public DeviceMetricsThresholds withTemperature(double temperature) {
        return new DeviceMetricsThresholds(temperature, utilization);
    }

    public DeviceMetricsThresholds withUtilization(double utilization) {
        return new DeviceMetricsThresholds(temperature, utilization);
    }
}
