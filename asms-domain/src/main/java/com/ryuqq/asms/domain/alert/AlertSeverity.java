package com.ryuqq.asms.domain.alert;

import java.util.Optional;

/**
 * 알림 심각도.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum AlertSeverity {

    INFO("info"),
    WARNING("warning"),
    CRITICAL("critical");

    private final String value;

    AlertSeverity(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * 텍스트 토큰으로 조회.
     *
     * @param value 토큰 (정확히 일치해야 함)
     * @return 심각도, 알 수 없는 토큰이면 empty
     */
    public static Optional<AlertSeverity> fromValue(String value) {
        for (AlertSeverity severity : values()) {
            if (severity.value.equals(value)) {
                return Optional.of(severity);
            }
        }
        return Optional.empty();
    }

    static Object[] tokens() {
        AlertSeverity[] all = values();
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
