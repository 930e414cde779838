package com.ryuqq.asms.runtime.event;

import com.ryuqq.asms.core.context.Cancellable;
import com.ryuqq.asms.core.event.DomainEvent;
import com.ryuqq.asms.core.event.Event;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * InMemoryEventBus 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class InMemoryEventBusTest {

    private InMemoryEventBus bus;

    @BeforeEach
    void setUp() {
        bus = new InMemoryEventBus();
    }

    @Test
    void 발행된_이벤트_기록() {
        bus.publish(event("alert.triggered"));
        bus.publish(event("alert.resolved"));

        assertThat(bus.size()).isEqualTo(2);
        assertThat(bus.eventsOfType("alert.resolved")).hasSize(1);
    }

    @Test
    void 타입별_구독과_해제() {
        // given
        List<Event> received = new ArrayList<>();
        Cancellable subscription = bus.subscribe("alert.triggered", received::add);

        // when
        bus.publish(event("alert.triggered"));
        bus.publish(event("alert.resolved"));
        subscription.cancel();
        bus.publish(event("alert.triggered"));

        // then
        assertThat(received).hasSize(1);
    }

    @Test
    void 전체_구독() {
        List<Event> received = new ArrayList<>();
        bus.subscribeAll(received::add);

        bus.publish(event("a.x"));
        bus.publish(event("b.y"));

        assertThat(received).extracting(Event::type).containsExactly("a.x", "b.y");
    }

    @Test
    void 구독자_예외는_다른_구독자에_영향_없음() {
        List<Event> received = new ArrayList<>();
        bus.subscribe("a.x", e -> {
            throw new IllegalStateException("boom");
        });
        bus.subscribe("a.x", received::add);

        bus.publish(event("a.x"));

        assertThat(received).hasSize(1);
    }

    @Test
    void clear_기록과_구독_초기화() {
        List<Event> received = new ArrayList<>();
        bus.subscribe("a.x", received::add);
        bus.publish(event("a.x"));

        bus.clear();
        bus.publish(event("a.x"));

        assertThat(received).hasSize(1);
        assertThat(bus.size()).isEqualTo(1);
    }

    private static DomainEvent event(String type) {
        return DomainEvent.of(type, type.substring(0, type.indexOf('.')), Map.of(), Clock.systemUTC());
    }
}
