package com.ryuqq.asms.domain.alert;

import java.util.Optional;

/**
 * 알림 상태.
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * FIRING → ACKNOWLEDGED → RESOLVED
 *    └──────────────────→ RESOLVED
 * </pre>
 *
 * <p>활성 알림은 FIRING 또는 ACKNOWLEDGED 상태입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum AlertStatus {

    FIRING("firing"),
    ACKNOWLEDGED("acknowledged"),
    RESOLVED("resolved");

    private final String value;

    AlertStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean isActive() {
        return this == FIRING || this == ACKNOWLEDGED;
    }

    public static Optional<AlertStatus> fromValue(String value) {
        for (AlertStatus status : values()) {
            if (status.value.equals(value)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }

    static Object[] tokens() {
        AlertStatus[] all = values();
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
