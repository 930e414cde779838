package com.ryuqq.asms.domain.device;

import java.util.Optional;

/**
 * 장치 상태.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum HealthStatus {

    HEALTHY("healthy"),
    WARNING("warning"),
    CRITICAL("critical"),
    UNKNOWN("unknown");

    private final String value;

    HealthStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Optional<HealthStatus> fromValue(String value) {
        for (HealthStatus status : values()) {
            if (status.value.equals(value)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return value;
    }
}
