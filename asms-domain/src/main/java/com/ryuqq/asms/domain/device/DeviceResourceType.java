package com.ryuqq.asms.domain.device;

import java.util.Optional;

/**
 * 장치 Resource 종류 (URI 마지막 경로).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum DeviceResourceType {

    INFO("info"),
    METRICS("metrics"),
    HEALTH("health");

    private final String value;

    DeviceResourceType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Optional<DeviceResourceType> fromValue(String value) {
        for (DeviceResourceType type : values()) {
            if (type.value.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return value;
    }
}
