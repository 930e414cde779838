package com.ryuqq.asms.domain.alert;

import com.ryuqq.asms.core.context.CallContext;

import java.util.List;

/**
 * 알림 규칙과 알림 저장소.
 *
 * <p>모든 메서드는 호출 컨텍스트가 종료되었으면 취소 예외를 던집니다.
 * 존재하지 않는 대상은 {@code alert_rule_not_found} / {@code alert_not_found}로 실패합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface AlertStore {

    /**
     * 규칙 저장. ID가 비어 있으면 새로 할당하고 createdAt/updatedAt을 현재 시각으로 설정합니다.
     *
     * @return 저장된 규칙
     * @throws com.ryuqq.asms.core.error.UnitException ID 충돌 시 (already_exists)
     */
    AlertRule createRule(CallContext ctx, AlertRule rule);

    AlertRule getRule(CallContext ctx, String id);

    /**
     * 규칙 갱신. createdAt은 유지하고 updatedAt을 갱신합니다.
     */
    AlertRule updateRule(CallContext ctx, AlertRule rule);

    void deleteRule(CallContext ctx, String id);

    List<AlertRule> listRules(CallContext ctx, RuleFilter filter);

    /**
     * 알림 저장. ID가 비어 있으면 새로 할당하며, 같은 ID가 있으면 덮어씁니다.
     */
    Alert createAlert(CallContext ctx, Alert alert);

    Alert getAlert(CallContext ctx, String id);

    Alert updateAlert(CallContext ctx, Alert alert);

    /**
     * 필터 + 페이지 조회. total은 페이지 적용 전 개수입니다.
     */
    AlertPage listAlerts(CallContext ctx, AlertFilter filter);

    /**
     * firing 또는 acknowledged 상태 알림 조회.
     */
    List<Alert> listActiveAlerts(CallContext ctx);
}
