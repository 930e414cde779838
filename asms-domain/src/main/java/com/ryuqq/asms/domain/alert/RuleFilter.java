package com.ryuqq.asms.domain.alert;

/**
 * Rule listing filter.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param enabledOnly only enabled rules when true
 */
public record RuleFilter(boolean enabledOnly) {

    public static final RuleFilter ALL = new RuleFilter(false);
    public static final RuleFilter ENABLED = new RuleFilter(true);

    public boolean matches(AlertRule rule) {
        return !enabledOnly || rule.enabled();
    }
}
