package com.ryuqq.asms.runtime.event;

import com.ryuqq.asms.core.event.DomainEvent;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.Logger;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * Slf4jEventPublisher 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class Slf4jEventPublisherTest {

    @Mock
    private Logger log;

    @Test
    void 이벤트_필드를_info로_기록() {
        // given
        Slf4jEventPublisher publisher = new Slf4jEventPublisher(log);
        DomainEvent event = DomainEvent.of("alert.resolved", "alert", Map.of("alert_id", "a1"),
            Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC));

        // when
        publisher.publish(event);

        // then
        verify(log).info(anyString(), eq("alert.resolved"), eq("alert"), eq(event.correlationId()),
            eq(Map.of("alert_id", "a1")));
    }

    @Test
    void null_이벤트는_무시() {
        new Slf4jEventPublisher(log).publish(null);

        verifyNoInteractions(log);
    }

    @Test
    void null_Logger는_거부() {
        assertThatThrownBy(() -> new Slf4jEventPublisher(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
