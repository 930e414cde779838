package com.ryuqq.asms.testkit.contract;

import com.ryuqq.asms.core.error.ErrorCode;
import com.ryuqq.asms.domain.alert.Alert;
import com.ryuqq.asms.domain.alert.AlertRule;
import com.ryuqq.asms.domain.alert.AlertSeverity;
import com.ryuqq.asms.domain.alert.AlertStatus;
import com.ryuqq.asms.domain.alert.RuleFilter;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Alert 도메인 end-to-end 계약 테스트.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>규칙 생성 성공 및 잘못된 severity 거부</li>
 *   <li>acknowledge 상태 전이</li>
 *   <li>history 페이지네이션 (total은 limit과 무관)</li>
 *   <li>resolve 멱등성, active 정의</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class AlertLifecycleContractTest extends AbstractUnitContractTest {

    @Test
    void 규칙_생성_성공() {
        // when
        Map<String, Object> output = execute("alert.create_rule", Map.of(
            "name", "High CPU",
            "condition", "cpu.utilization > 80",
            "severity", "warning",
            "channels", List.of("email", "slack"),
            "cooldown", 300
        ));

        // then
        assertThat(output).containsOnlyKeys("rule_id");
        List<AlertRule> rules = alertStore.listRules(ctx, RuleFilter.ALL);
        assertThat(rules).hasSize(1);
        AlertRule rule = rules.get(0);
        assertThat(rule.id()).isEqualTo(output.get("rule_id"));
        assertThat(rule.enabled()).isTrue();
        assertThat(rule.channels()).containsExactly("email", "slack");
        assertThat(rule.cooldown()).isEqualTo(300);
        assertThat(eventBus.eventsOfType("execution_completed")).hasSize(1);
    }

    @Test
    void 잘못된_severity는_invalid_input이고_저장소_변화_없음() {
        // when
        RuntimeException error = assertErrorCode(() -> execute("alert.create_rule",
            Map.of("name", "X", "condition", "y>1", "severity", "urgent")), ErrorCode.INVALID_INPUT);

        // then
        assertThat(error.getMessage()).contains("severity");
        assertThat(alertStore.listRules(ctx, RuleFilter.ALL)).isEmpty();
        assertThat(dispatcher.toErrorResponse(error).httpStatus()).isEqualTo(400);
    }

    @Test
    void int_범위를_넘는_cooldown은_저장되지_않음() {
        // when
        RuntimeException error = assertErrorCode(() -> execute("alert.create_rule",
            Map.of("name", "X", "condition", "y>1", "severity", "info", "cooldown", 4294967596L)),
            ErrorCode.INVALID_INPUT);

        // then
        assertThat(error.getMessage()).contains("cooldown");
        assertThat(alertStore.listRules(ctx, RuleFilter.ALL)).isEmpty();
    }

    @Test
    void 규칙_왕복_조회는_시각_외_동일() {
        // given
        String ruleId = (String) execute("alert.create_rule", Map.of(
            "name", "GPU temp", "condition", "gpu.temperature > 85", "severity", "critical")).get("rule_id");
        clock.advanceSeconds(10);

        // when
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> rules = (List<Map<String, Object>>) execute("alert.list_rules", Map.of())
            .get("rules");

        // then
        assertThat(rules).hasSize(1);
        assertThat(rules.get(0))
            .containsEntry("id", ruleId)
            .containsEntry("name", "GPU temp")
            .containsEntry("condition", "gpu.temperature > 85")
            .containsEntry("severity", "critical")
            .containsEntry("enabled", true);
        AlertRule stored = alertStore.getRule(ctx, ruleId);
        assertThat(stored.createdAt()).isBeforeOrEqualTo(stored.updatedAt());
        assertThat(stored.updatedAt()).isBeforeOrEqualTo(clock.instant());
    }

    @Test
    void acknowledge_상태_전이() {
        // given
        seedAlert("a1", AlertStatus.FIRING, T0);

        // when
        Map<String, Object> output = execute("alert.acknowledge", Map.of("alert_id", "a1"));

        // then
        assertThat(output).containsEntry("success", true);
        Alert alert = alertStore.getAlert(ctx, "a1");
        assertThat(alert.status()).isEqualTo(AlertStatus.ACKNOWLEDGED);
        assertThat(alert.acknowledgedAt()).isNotNull();
    }

    @Test
    void 없는_알림_acknowledge는_alert_not_found() {
        RuntimeException error = assertErrorCode(() -> execute("alert.acknowledge", Map.of("alert_id", "nope")),
            ErrorCode.ALERT_NOT_FOUND);

        assertThat(dispatcher.toErrorResponse(error).httpStatus()).isEqualTo(404);
    }

    @Test
    @SuppressWarnings("unchecked")
    void history_페이지네이션() {
        // given
        seedAlert("a1", AlertStatus.FIRING, T0);
        seedAlert("a2", AlertStatus.FIRING, T0.plusSeconds(1));
        seedAlert("a3", AlertStatus.FIRING, T0.plusSeconds(2));
        seedAlert("a4", AlertStatus.ACKNOWLEDGED, T0.plusSeconds(3));
        seedAlert("a5", AlertStatus.RESOLVED, T0.plusSeconds(4));

        // when
        Map<String, Object> output = execute("alert.history", Map.of("status", "firing", "limit", 2));

        // then
        assertThat((List<Map<String, Object>>) output.get("alerts")).hasSize(2);
        assertThat(output).containsEntry("total", 3);
    }

    @Test
    void resolve는_멱등이고_resolvedAt은_감소하지_않음() {
        // given
        seedAlert("a1", AlertStatus.FIRING, T0);
        execute("alert.resolve", Map.of("alert_id", "a1"));
        Instant first = alertStore.getAlert(ctx, "a1").resolvedAt();
        clock.advanceSeconds(30);

        // when
        Map<String, Object> output = execute("alert.resolve", Map.of("alert_id", "a1"));

        // then
        assertThat(output).containsEntry("success", true);
        Alert alert = alertStore.getAlert(ctx, "a1");
        assertThat(alert.status()).isEqualTo(AlertStatus.RESOLVED);
        assertThat(alert.resolvedAt()).isAfterOrEqualTo(first);
    }

    @Test
    @SuppressWarnings("unchecked")
    void active는_firing과_acknowledged만_반환() {
        // given
        seedAlert("a1", AlertStatus.FIRING, T0);
        seedAlert("a2", AlertStatus.ACKNOWLEDGED, T0.plusSeconds(1));
        seedAlert("a3", AlertStatus.RESOLVED, T0.plusSeconds(2));

        // when
        List<Map<String, Object>> alerts = (List<Map<String, Object>>) execute("alert.active", Map.of())
            .get("alerts");

        // then
        assertThat(alerts).extracting(alert -> alert.get("id")).containsExactlyInAnyOrder("a1", "a2");
    }

    private void seedAlert(String id, AlertStatus status, Instant triggeredAt) {
        Instant acknowledgedAt = status == AlertStatus.ACKNOWLEDGED ? triggeredAt : null;
        Instant resolvedAt = status == AlertStatus.RESOLVED ? triggeredAt : null;
        alertStore.createAlert(ctx, new Alert(id, "rule-1", "CPU", AlertSeverity.WARNING, status, "cpu high",
            Map.of(), triggeredAt, acknowledgedAt, resolvedAt));
    }
}
