package com.ryuqq.asms.domain.alert;

import com.ryuqq.asms.core.context.CallContext;
import com.ryuqq.asms.core.contract.Command;
import com.ryuqq.asms.core.contract.Example;
import com.ryuqq.asms.core.contract.UnitDescriptor;
import com.ryuqq.asms.core.contract.Units;
import com.ryuqq.asms.core.error.ErrorCode;
import com.ryuqq.asms.core.error.UnitException;
import com.ryuqq.asms.core.event.EventPublisher;
import com.ryuqq.asms.core.schema.Inputs;
import com.ryuqq.asms.core.schema.Schema;
import com.ryuqq.asms.domain.support.DomainEvents;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 알림 도메인 Command 모음.
 *
 * <p><strong>제공 Command:</strong></p>
 * <ul>
 *   <li>{@code alert.create_rule} - 규칙 생성 (enabled=true)</li>
 *   <li>{@code alert.update_rule} - 부분 갱신 (빈 문자열 필드는 무시)</li>
 *   <li>{@code alert.delete_rule} - 규칙 삭제</li>
 *   <li>{@code alert.acknowledge} - firing → acknowledged</li>
 *   <li>{@code alert.resolve} - 해결 처리 (재호출 허용)</li>
 * </ul>
 *
 * <p>저장소 오류는 "create rule: ..." 형태의 문맥 문구로 래핑되며 코드는 유지됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class AlertCommands {

    static final UnitDescriptor CREATE_RULE = UnitDescriptor.of(
        "alert.create_rule",
        "Create a new alert rule",
        Schema.object()
            .property("name", Schema.string().description("Rule name"))
            .property("condition", Schema.string().description("Alert condition expression"))
            .property("severity", Schema.string().enumValues(AlertSeverity.tokens()))
            .property("channels", Schema.arrayOf(Schema.string()).description("Notification channels"))
            .property("cooldown", Schema.number().min(0).description("Cooldown in seconds"))
            .required("name", "condition", "severity")
            .build(),
        Schema.object().property("rule_id", Schema.string()).required("rule_id").build(),
        List.of(Example.of(
            Map.of("name", "High CPU Usage", "condition", "cpu.utilization > 80", "severity", "warning",
                "channels", List.of("email", "slack"), "cooldown", 300),
            Map.of("rule_id", "rule-123"),
            "Create a CPU usage alert"
        ))
    );

    static final UnitDescriptor UPDATE_RULE = UnitDescriptor.of(
        "alert.update_rule",
        "Update an existing alert rule",
        Schema.object()
            .property("rule_id", Schema.string())
            .property("name", Schema.string())
            .property("condition", Schema.string())
            .property("enabled", Schema.bool())
            .required("rule_id")
            .build(),
        successSchema(),
        List.of(Example.of(Map.of("rule_id", "rule-123", "enabled", false), Map.of("success", true),
            "Disable a rule"))
    );

    static final UnitDescriptor DELETE_RULE = UnitDescriptor.of(
        "alert.delete_rule",
        "Delete an alert rule",
        Schema.object().property("rule_id", Schema.string()).required("rule_id").build(),
        successSchema(),
        List.of()
    );

    static final UnitDescriptor ACKNOWLEDGE = UnitDescriptor.of(
        "alert.acknowledge",
        "Acknowledge a firing alert",
        Schema.object().property("alert_id", Schema.string()).required("alert_id").build(),
        successSchema(),
        List.of(Example.of(Map.of("alert_id", "alert-456"), Map.of("success", true), "Acknowledge an alert"))
    );

    static final UnitDescriptor RESOLVE = UnitDescriptor.of(
        "alert.resolve",
        "Resolve an alert",
        Schema.object().property("alert_id", Schema.string()).required("alert_id").build(),
        successSchema(),
        List.of()
    );

    private final AlertStore store;
    private final EventPublisher publisher;
    private final Clock clock;

    public AlertCommands(AlertStore store, EventPublisher publisher, Clock clock) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.store = store;
        this.publisher = EventPublisher.orNoop(publisher);
        this.clock = clock;
    }

    public Command createRule() {
        return Units.command(CREATE_RULE, this::handleCreateRule, publisher, clock);
    }

    public Command updateRule() {
        return Units.command(UPDATE_RULE, this::handleUpdateRule, publisher, clock);
    }

    public Command deleteRule() {
        return Units.command(DELETE_RULE, this::handleDeleteRule, publisher, clock);
    }

    public Command acknowledge() {
        return Units.command(ACKNOWLEDGE, this::handleAcknowledge, publisher, clock);
    }

    public Command resolve() {
        return Units.command(RESOLVE, this::handleResolve, publisher, clock);
    }

    public List<Command> all() {
        return List.of(createRule(), updateRule(), deleteRule(), acknowledge(), resolve());
    }

    private Map<String, Object> handleCreateRule(CallContext ctx, Map<String, Object> input) {
        String name = Inputs.requireString(input, "name");
        String condition = Inputs.requireString(input, "condition");
        AlertSeverity severity = parseSeverity(Inputs.requireString(input, "severity"));
        List<String> channels = Inputs.textList(input, "channels").orElse(List.of());
        int cooldown = Inputs.integer(input, "cooldown").orElse(0);
        if (cooldown < 0) {
            throw UnitException.of(AlertEvents.DOMAIN, ErrorCode.INVALID_INPUT,
                "cooldown must be non-negative (current: " + cooldown + ")");
        }

        AlertRule created;
        try {
            created = store.createRule(ctx, AlertRule.create(name, condition, severity, channels, cooldown));
        } catch (UnitException e) {
            throw UnitException.wrap("create rule", e);
        }
        return Map.of("rule_id", created.id());
    }

    private Map<String, Object> handleUpdateRule(CallContext ctx, Map<String, Object> input) {
        String ruleId = Inputs.requireString(input, "rule_id");

        AlertRule rule;
        try {
            rule = store.getRule(ctx, ruleId);
        } catch (UnitException e) {
            throw UnitException.wrap("get rule", e);
        }

        Optional<String> name = Inputs.nonEmptyString(input, "name");
        if (name.isPresent()) {
            rule = rule.withName(name.get());
        }
        Optional<String> condition = Inputs.nonEmptyString(input, "condition");
        if (condition.isPresent()) {
            rule = rule.withCondition(condition.get());
        }
        Optional<Boolean> enabled = Inputs.bool(input, "enabled");
        if (enabled.isPresent()) {
            rule = rule.withEnabled(enabled.get());
        }

        try {
            store.updateRule(ctx, rule);
        } catch (UnitException e) {
            throw UnitException.wrap("update rule", e);
        }
        return success();
    }

    private Map<String, Object> handleDeleteRule(CallContext ctx, Map<String, Object> input) {
        String ruleId = Inputs.requireString(input, "rule_id");
        try {
            store.deleteRule(ctx, ruleId);
        } catch (UnitException e) {
            throw UnitException.wrap("delete rule", e);
        }
        return success();
    }

    private Map<String, Object> handleAcknowledge(CallContext ctx, Map<String, Object> input) {
        String alertId = Inputs.requireString(input, "alert_id");
        Alert acknowledged;
        try {
            Alert alert = store.getAlert(ctx, alertId);
            acknowledged = store.updateAlert(ctx, alert.acknowledge(clock.instant()));
        } catch (UnitException e) {
            throw UnitException.wrap("acknowledge alert", e);
        }
        DomainEvents.publish(publisher, AlertEvents.acknowledged(acknowledged, clock));
        return success();
    }

    private Map<String, Object> handleResolve(CallContext ctx, Map<String, Object> input) {
        String alertId = Inputs.requireString(input, "alert_id");
        Alert resolved;
        try {
            Alert alert = store.getAlert(ctx, alertId);
            resolved = store.updateAlert(ctx, alert.resolve(clock.instant()));
        } catch (UnitException e) {
            throw UnitException.wrap("resolve alert", e);
        }
        DomainEvents.publish(publisher, AlertEvents.resolved(resolved, clock));
        return success();
    }

    static AlertSeverity parseSeverity(String value) {
        return AlertSeverity.fromValue(value).orElseThrow(() ->
            UnitException.of(AlertEvents.DOMAIN, ErrorCode.INVALID_INPUT, "invalid severity: " + value));
    }

    private static Schema successSchema() {
        return Schema.object().property("success", Schema.bool()).required("success").build();
    }

    private static Map<String, Object> success() {
        return Map.of("success", true);
    }
}
