package com.ryuqq.asms.domain.device;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wire projections of device values.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class DeviceViews {

    // Utility class - prevent instantiation
    private DeviceViews() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * detect 결과 항목.
     */
    static Map<String, Object> summary(DeviceInfo device) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", device.id());
        view.put("name", device.name());
        view.put("vendor", device.vendor());
        view.put("type", device.type());
        view.put("memory", device.memory());
        view.put("architecture", device.architecture());
        return view;
    }

    static Map<String, Object> info(DeviceInfo device) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", device.id());
        view.put("name", device.name());
        view.put("vendor", device.vendor());
        view.put("type", device.type());
        view.put("architecture", device.architecture());
        view.put("capabilities", device.capabilities());
        view.put("memory", device.memory());
        return view;
    }

    static Map<String, Object> metrics(DeviceMetrics metrics) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("utilization", metrics.utilization());
        view.put("temperature", metrics.temperature());
        view.put("power", metrics.power());
        view.put("memory_used", metrics.memoryUsed());
        view.put("memory_total", metrics.memoryTotal());
        return view;
    }

    static Map<String, Object> health(DeviceHealth health) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("status", health.status().getValue());
        view.put("issues", health.issues());
        return view;
    }

    static Map<String, Object> health(String deviceId, DeviceHealth health) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("device_id", deviceId);
        view.putAll(health(health));
        return view;
    }

    static Object[] healthTokens() {
        HealthStatus[] all = HealthStatus.values();
        Object[] tokens = new Object[all.length];
        for (int i = 0; i < all.length; i++) {
            tokens[i] = all[i].getValue();
        }
        return tokens;
    }
}
