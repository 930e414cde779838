package com.ryuqq.asms.domain.service;

import java.util.Optional;

/**
 * 서비스 상태.
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * PENDING ─┐
 * STOPPED ─┼→ STARTING → RUNNING
 * FAILED  ─┘      └────→ FAILED (provider 실패)
 *
 * RUNNING | STARTING | PENDING | FAILED → STOPPING → STOPPED
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ServiceStatus {

    PENDING("pending"),
    STARTING("starting"),
    RUNNING("running"),
    STOPPING("stopping"),
    STOPPED("stopped"),
    FAILED("failed");

    private final String value;

    ServiceStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * start 가능 여부.
     */
    public boolean isStartable() {
        return this == PENDING || this == STOPPED || this == FAILED;
    }

    public static Optional<ServiceStatus> fromValue(String value) {
        for (ServiceStatus status : values()) {
            if (status.value.equals(value)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }

    static Object[] tokens() {
        ServiceStatus[] all = values();
        Object[] tokens = new Object[all.length];
        for (int i = 0; i < all.length; i++) {
            tokens[i] = all[i].value;
        }
        return tokens;
    }

    @Override
    public String toString() {
        return value;
    }
}
