package com.ryuqq.asms.domain.alert;

/**
 * 알림 조회 필터.
 *
 * <p>ruleId, status, severity는 AND로 결합되며 null이면 조건 없음입니다.
 * offset은 필터 결과 길이로 잘리고, limit 0은 무제한입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param ruleId 규칙 ID (nullable)
 * @param status 상태 (nullable)
 * @param severity 심각도 (nullable)
 * @param limit 최대 개수 (0 = 무제한)
 * @param offset 시작 위치
 */
public record AlertFilter(String ruleId, AlertStatus status, AlertSeverity severity, int limit, int offset) {

    public static final AlertFilter ALL = new AlertFilter(null, null, null, 0, 0);

    public AlertFilter {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be non-negative (current: " + limit + ")");
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be non-negative (current: " + offset + ")");
        }
        ruleId = ruleId == null || ruleId.isEmpty() ? null : ruleId;
    }

    public boolean matches(Alert alert) {
        return (ruleId == null || ruleId.equals(alert.ruleId()))
            && (status == null || status == alert.status())
            && (severity == null || severity == alert.severity());
    }

    public AlertFilter withLimit(int limit) {
        return new AlertFilter(ruleId, status, severity, limit, offset);
    }

    public AlertFilter withOffset(int offset) {
        return new AlertFilter(ruleId, status, severity, limit, offset);
    }
}
