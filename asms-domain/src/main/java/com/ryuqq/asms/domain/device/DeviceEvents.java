package com.ryuqq.asms.domain.device;

import com.ryuqq.asms.core.event.DomainEvent;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 장치 도메인 이벤트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DeviceEvents {

    public static final String DOMAIN = "device";
    public static final String DETECTED = "device.detected";
    public static final String HEALTH_CHANGED = "device.health_changed";
    public static final String METRICS_ALERT = "device.metrics_alert";

    // Utility class - prevent instantiation
    private DeviceEvents() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static DomainEvent detected(DeviceInfo device, Clock clock) {
        return DomainEvent.of(DETECTED, DOMAIN, Map.of("device", DeviceViews.info(device)), clock);
    }

    public static DomainEvent healthChanged(String deviceId, String oldStatus, String newStatus, Clock clock) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("device_id", deviceId);
        payload.put("old_status", oldStatus);
        payload.put("new_status", newStatus);
        return DomainEvent.of(HEALTH_CHANGED, DOMAIN, payload, clock);
    }

    public static DomainEvent metricsAlert(String deviceId, String metric, double value, double threshold,
                                           Clock clock) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("device_id", deviceId);
        payload.put("metric", metric);
        payload.put("value", value);
        payload.put("threshold", threshold);
        return DomainEvent.of(METRICS_ALERT, DOMAIN, payload, clock);
    }
}
