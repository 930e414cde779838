package com.ryuqq.asms.domain.alert;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 발생한 알림 (불변 record).
 *
 * <p>상태 전이는 새 인스턴스를 반환합니다. {@link #resolve(Instant)}는 이미 해결된 알림에도
 * 적용되며 resolvedAt만 갱신합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param id 알림 ID
 * @param ruleId 규칙 ID
 * @param ruleName 규칙 이름
 * @param severity 심각도
 * @param status 상태
 * @param message 메시지
 * @param metrics 발생 시점 메트릭 (빈 맵 가능)
 * @param triggeredAt 발생 시각
 * @param acknowledgedAt 확인 시각 (nullable)
 * @param resolvedAt 해결 시각 (nullable)
 */
public record Alert(
    String id,
    String ruleId,
    String ruleName,
    AlertSeverity severity,
    AlertStatus status,
    String message,
    Map<String, Object> metrics,
    Instant triggeredAt,
    Instant acknowledgedAt,
    Instant resolvedAt
) {

    public Alert {
        if (severity == null) {
            throw new IllegalArgumentException("severity cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (triggeredAt == null) {
            throw new IllegalArgumentException("triggeredAt cannot be null");
        }
        id = id == null ? "" : id;
        metrics = metrics == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
    }

    /**
     * 규칙으로부터 firing 알림 생성.
     */
    public static Alert firing(AlertRule rule, String message, Map<String, Object> metrics, Instant triggeredAt) {
        return new Alert("", rule.id(), rule.name(), rule.severity(), AlertStatus.FIRING, message, metrics,
            triggeredAt, null, null);
    }

    public Alert acknowledge(Instant at) {
        return new Alert(id, ruleId, ruleName, severity, AlertStatus.ACKNOWLEDGED, message, metrics, triggeredAt,
            at, resolvedAt);
    }

    public Alert resolve(Instant at) {
        return new Alert(id, ruleId, ruleName, severity, AlertStatus.RESOLVED, message, metrics, triggeredAt,
            acknowledgedAt, at);
    }

    public Alert withId(String id) {
        return new Alert(id, ruleId, ruleName, severity, status, message, metrics, triggeredAt, acknowledgedAt,
            resolvedAt);
    }

    public boolean isActive() {
        return status.isActive();
    }
}
