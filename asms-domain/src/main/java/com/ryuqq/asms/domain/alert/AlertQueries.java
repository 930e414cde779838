package com.ryuqq.asms.domain.alert;

import com.ryuqq.asms.core.context.CallContext;
import com.ryuqq.asms.core.contract.Example;
import com.ryuqq.asms.core.contract.Query;
import com.ryuqq.asms.core.contract.UnitDescriptor;
import com.ryuqq.asms.core.contract.Units;
import com.ryuqq.asms.core.error.ErrorCode;
import com.ryuqq.asms.core.error.UnitException;
import com.ryuqq.asms.core.event.EventPublisher;
import com.ryuqq.asms.core.schema.Inputs;
import com.ryuqq.asms.core.schema.Schema;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 알림 도메인 Query 모음.
 *
 * <p><strong>제공 Query:</strong></p>
 * <ul>
 *   <li>{@code alert.list_rules} - 규칙 목록 (enabled_only)</li>
 *   <li>{@code alert.history} - 필터 + 페이지 조회, total 포함</li>
 *   <li>{@code alert.active} - 활성 알림 목록</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class AlertQueries {

    static final int DEFAULT_HISTORY_LIMIT = 100;
    static final int MAX_HISTORY_LIMIT = 1000;

    private static final Schema RULE_SCHEMA = Schema.object()
        .property("id", Schema.string())
        .property("name", Schema.string())
        .property("condition", Schema.string())
        .property("severity", Schema.string())
        .property("channels", Schema.arrayOf(Schema.string()))
        .property("cooldown", Schema.number())
        .property("enabled", Schema.bool())
        .build();

    private static final Schema ALERT_SCHEMA = Schema.object()
        .property("id", Schema.string())
        .property("rule_id", Schema.string())
        .property("rule_name", Schema.string())
        .property("severity", Schema.string())
        .property("status", Schema.string())
        .property("message", Schema.string())
        .property("triggered_at", Schema.string())
        .build();

    static final UnitDescriptor LIST_RULES = UnitDescriptor.of(
        "alert.list_rules",
        "List alert rules",
        Schema.object().property("enabled_only", Schema.bool().description("Only enabled rules")).build(),
        Schema.object().property("rules", Schema.arrayOf(RULE_SCHEMA)).required("rules").build(),
        List.of(Example.of(Map.of("enabled_only", true), Map.of("rules", List.of()), "List enabled rules"))
    );

    static final UnitDescriptor HISTORY = UnitDescriptor.of(
        "alert.history",
        "Get alert history",
        Schema.object()
            .property("rule_id", Schema.string())
            .property("status", Schema.string().enumValues(AlertStatus.tokens()))
            .property("severity", Schema.string().enumValues(AlertSeverity.tokens()))
            .property("limit", Schema.number().min(1).max(MAX_HISTORY_LIMIT).defaultValue(DEFAULT_HISTORY_LIMIT))
            .property("offset", Schema.number().min(0).defaultValue(0))
            .build(),
        Schema.object()
            .property("alerts", Schema.arrayOf(ALERT_SCHEMA))
            .property("total", Schema.number())
            .required("alerts", "total")
            .build(),
        List.of(Example.of(Map.of("status", "firing", "limit", 10), Map.of("alerts", List.of(), "total", 0),
            "Recent firing alerts"))
    );

    static final UnitDescriptor ACTIVE = UnitDescriptor.of(
        "alert.active",
        "Get active alerts",
        Schema.object().build(),
        Schema.object().property("alerts", Schema.arrayOf(ALERT_SCHEMA)).required("alerts").build(),
        List.of()
    );

    private final AlertStore store;
    private final EventPublisher publisher;
    private final Clock clock;

    public AlertQueries(AlertStore store, EventPublisher publisher, Clock clock) {
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

    public Query listRules() {
        return Units.query(LIST_RULES, this::handleListRules, publisher, clock);
    }

    public Query history() {
        return Units.query(HISTORY, this::handleHistory, publisher, clock);
    }

    public Query active() {
        return Units.query(ACTIVE, this::handleActive, publisher, clock);
    }

    public List<Query> all() {
        return List.of(listRules(), history(), active());
    }

    private Map<String, Object> handleListRules(CallContext ctx, Map<String, Object> input) {
        RuleFilter filter = new RuleFilter(Inputs.bool(input, "enabled_only").orElse(false));
        try {
            return Map.of("rules", AlertViews.rules(store.listRules(ctx, filter)));
        } catch (UnitException e) {
            throw UnitException.wrap("list rules", e);
        }
    }

    private Map<String, Object> handleHistory(CallContext ctx, Map<String, Object> input) {
        AlertFilter filter = parseHistoryFilter(input);
        AlertPage page;
        try {
            page = store.listAlerts(ctx, filter);
        } catch (UnitException e) {
            throw UnitException.wrap("list alerts", e);
        }
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("alerts", AlertViews.alerts(page.alerts()));
        result.put("total", page.total());
        return result;
    }

    private Map<String, Object> handleActive(CallContext ctx, Map<String, Object> input) {
        try {
            return Map.of("alerts", AlertViews.alerts(store.listActiveAlerts(ctx)));
        } catch (UnitException e) {
            throw UnitException.wrap("list active alerts", e);
        }
    }

    static AlertFilter parseHistoryFilter(Map<String, Object> input) {
        String ruleId = Inputs.string(input, "rule_id");

        AlertStatus status = Inputs.nonEmptyString(input, "status")
            .map(value -> AlertStatus.fromValue(value).orElseThrow(() ->
                invalid("invalid status: " + value)))
            .orElse(null);
        AlertSeverity severity = Inputs.nonEmptyString(input, "severity")
            .map(AlertCommands::parseSeverity)
            .orElse(null);

        int limit = Inputs.integer(input, "limit").orElse(DEFAULT_HISTORY_LIMIT);
        if (limit < 1 || limit > MAX_HISTORY_LIMIT) {
            throw invalid("limit must be between 1 and " + MAX_HISTORY_LIMIT + " (current: " + limit + ")");
        }
        int offset = Inputs.integer(input, "offset").orElse(0);
        if (offset < 0) {
            throw invalid("offset must be non-negative (current: " + offset + ")");
        }
        return new AlertFilter(ruleId, status, severity, limit, offset);
    }

    private static UnitException invalid(String message) {
        return UnitException.of(AlertEvents.DOMAIN, ErrorCode.INVALID_INPUT, message);
    }
}
