package com.ryuqq.asms.domain.alert;

import java.time.Instant;
import java.util.List;

/**
 * 알림 규칙 (불변 record).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param id 규칙 ID (저장 전에는 빈 문자열 가능)
 * @param name 이름
 * @param condition 조건식 (예: "cpu.utilization &gt; 80")
 * @param severity 심각도
 * @param channels 알림 채널
 * @param cooldown 재알림 대기 시간 (초)
 * @param enabled 활성 여부
 * @param createdAt 생성 시각 (nullable)
 * @param updatedAt 수정 시각 (nullable)
 */
public record AlertRule(
    String id,
    String name,
    String condition,
    AlertSeverity severity,
    List<String> channels,
    int cooldown,
    boolean enabled,
    Instant createdAt,
    Instant updatedAt
) {

    public AlertRule {
        if (severity == null) {
            throw new IllegalArgumentException("severity cannot be null");
        }
        if (cooldown < 0) {
            throw new IllegalArgumentException("cooldown must be non-negative (current: " + cooldown + ")");
        }
        id = id == null ? "" : id;
        channels = channels == null ? List.of() : List.copyOf(channels);
    }

    /**
     * 저장 전 새 규칙 생성 (enabled=true).
     */
    public static AlertRule create(String name, String condition, AlertSeverity severity, List<String> channels,
                                   int cooldown) {
        return new AlertRule("", name, condition, severity, channels, cooldown, true, null, null);
    }

    public AlertRule withId(String id) {
        return new AlertRule(id, name, condition, severity, channels, cooldown, enabled, createdAt, updatedAt);
    }

    public AlertRule withName(String name) {
        return new AlertRule(id, name, condition, severity, channels, cooldown, enabled, createdAt, updatedAt);
    }

    public AlertRule withCondition(String condition) {
        return new AlertRule(id, name, condition, severity, channels, cooldown, enabled, createdAt, updatedAt);
    }

    public AlertRule withEnabled(boolean enabled) {
        return new AlertRule(id, name, condition, severity, channels, cooldown, enabled, createdAt, updatedAt);
    }

    AlertRule withTimestamps(Instant createdAt, Instant updatedAt) {
        return new AlertRule(id, name, condition, severity, channels, cooldown, enabled, createdAt, updatedAt);
    }
}
