package com.ryuqq.asms.domain.alert;

import com.ryuqq.asms.domain.support.Timestamps;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Wire projections of rules and alerts.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class AlertViews {

    // Utility class - prevent instantiation
    private AlertViews() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    static Map<String, Object> rule(AlertRule rule) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", rule.id());
        view.put("name", rule.name());
        view.put("condition", rule.condition());
        view.put("severity", rule.severity().getValue());
        view.put("channels", rule.channels());
        view.put("cooldown", rule.cooldown());
        view.put("enabled", rule.enabled());
        view.put("created_at", Timestamps.format(rule.createdAt()));
        view.put("updated_at", Timestamps.format(rule.updatedAt()));
        return view;
    }

    static Map<String, Object> alert(Alert alert) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", alert.id());
        view.put("rule_id", alert.ruleId());
        view.put("rule_name", alert.ruleName());
        view.put("severity", alert.severity().getValue());
        view.put("status", alert.status().getValue());
        view.put("message", alert.message());
        view.put("triggered_at", Timestamps.format(alert.triggeredAt()));
        if (alert.acknowledgedAt() != null) {
            view.put("acknowledged_at", Timestamps.format(alert.acknowledgedAt()));
        }
        if (alert.resolvedAt() != null) {
            view.put("resolved_at", Timestamps.format(alert.resolvedAt()));
        }
        if (!alert.metrics().isEmpty()) {
            view.put("metrics", alert.metrics());
        }
        return view;
    }

    static List<Map<String, Object>> rules(List<AlertRule> rules) {
        List<Map<String, Object>> views = new ArrayList<>(rules.size());
        for (AlertRule rule : rules) {
            views.add(rule(rule));
        }
        return views;
    }

    static List<Map<String, Object>> alerts(List<Alert> alerts) {
        List<Map<String, Object>> views = new ArrayList<>(alerts.size());
        for (Alert alert : alerts) {
            views.add(alert(alert));
        }
        return views;
    }
}
