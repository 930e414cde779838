package com.ryuqq.asms.domain.alert;

import com.ryuqq.asms.core.event.DomainEvent;

import java.time.Clock;

/**
 * 알림 도메인 이벤트 타입과 생성 헬퍼.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class AlertEvents {

    public static final String DOMAIN = "alert";
    public static final String TRIGGERED = "alert.triggered";
    public static final String ACKNOWLEDGED = "alert.acknowledged";
    public static final String RESOLVED = "alert.resolved";

    // Utility class - prevent instantiation
    private AlertEvents() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static DomainEvent triggered(Alert alert, Clock clock) {
        return DomainEvent.of(TRIGGERED, DOMAIN, AlertViews.alert(alert), clock);
    }

    public static DomainEvent acknowledged(Alert alert, Clock clock) {
        return DomainEvent.of(ACKNOWLEDGED, DOMAIN, AlertViews.alert(alert), clock);
    }

    public static DomainEvent resolved(Alert alert, Clock clock) {
        return DomainEvent.of(RESOLVED, DOMAIN, AlertViews.alert(alert), clock);
    }
}
