package com.ryuqq.asms.domain.support;

import com.ryuqq.asms.core.event.Event;
import com.ryuqq.asms.core.event.EventPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Best-effort domain event publishing.
 *
 * <p>A failing publisher never fails the operation that emitted the event.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DomainEvents {

    private static final Logger log = LoggerFactory.getLogger(DomainEvents.class);

    // Utility class - prevent instantiation
    private DomainEvents() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static void publish(EventPublisher publisher, Event event) {
        try {
            EventPublisher.orNoop(publisher).publish(event);
        } catch (RuntimeException e) {
            log.warn("Failed to publish {} event: {}", event.type(), e.getMessage(), e);
        }
    }
}
