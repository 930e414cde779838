package com.ryuqq.asms.core.event;

/**
 * Discards every event.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class NoopEventPublisher implements EventPublisher {

    public static final NoopEventPublisher INSTANCE = new NoopEventPublisher();

    private NoopEventPublisher() {
    }

    @Override
    public void publish(Event event) {
        // discard
    }
}
