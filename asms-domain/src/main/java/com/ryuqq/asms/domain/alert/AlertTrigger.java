package com.ryuqq.asms.domain.alert;

import com.ryuqq.asms.core.context.CallContext;
import com.ryuqq.asms.core.error.UnitException;
import com.ryuqq.asms.core.event.EventPublisher;
import com.ryuqq.asms.domain.support.DomainEvents;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;

/**
 * 규칙으로부터 알림을 발생시키는 진입점.
 *
 * <p>활성화된 규칙만 알림을 만들고 {@code alert.triggered} 이벤트를 발행합니다.
 * 비활성 규칙은 무시되며 empty를 반환합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class AlertTrigger {

    private static final Logger log = LoggerFactory.getLogger(AlertTrigger.class);

    private final AlertStore store;
    private final EventPublisher publisher;
    private final Clock clock;

    public AlertTrigger(AlertStore store, EventPublisher publisher, Clock clock) {
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

    /**
     * 알림 발생.
     *
     * @param ctx 호출 컨텍스트
     * @param rule 규칙
     * @param message 메시지
     * @param metrics 발생 시점 메트릭 (nullable)
     * @return 저장된 알림, 규칙이 비활성이면 empty
     */
    public Optional<Alert> fire(CallContext ctx, AlertRule rule, String message, Map<String, Object> metrics) {
        if (rule == null) {
            throw new IllegalArgumentException("rule cannot be null");
        }
        if (!rule.enabled()) {
            log.debug("Rule {} is disabled, alert not fired", rule.id());
            return Optional.empty();
        }
        Alert stored;
        try {
            stored = store.createAlert(ctx, Alert.firing(rule, message, metrics, clock.instant()));
        } catch (UnitException e) {
            throw UnitException.wrap("create alert", e);
        }
        log.info("Alert {} fired for rule {} ({})", stored.id(), rule.id(), rule.severity());
        DomainEvents.publish(publisher, AlertEvents.triggered(stored, clock));
        return Optional.of(stored);
    }

    /**
     * 규칙 ID로 알림 발생.
     */
    public Optional<Alert> fire(CallContext ctx, String ruleId, String message, Map<String, Object> metrics) {
        AlertRule rule;
        try {
            rule = store.getRule(ctx, ruleId);
        } catch (UnitException e) {
            throw UnitException.wrap("get rule", e);
        }
        return fire(ctx, rule, message, metrics);
    }
}
