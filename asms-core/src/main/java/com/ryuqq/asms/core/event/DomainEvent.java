package com.ryuqq.asms.core.event;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * 도메인 이벤트 (예: alert.acknowledged, service.started).
 *
 * <p>생성될 때마다 새로운 UUID correlationId를 부여합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param type 이벤트 타입
 * @param domain 도메인
 * @param payload 페이로드 (불변 맵)
 * @param timestamp 발생 시각
 * @param correlationId 이벤트 식별자
 */
public record DomainEvent(
    String type,
    String domain,
    Map<String, Object> payload,
    Instant timestamp,
    String correlationId
) implements Event {

    public DomainEvent {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type cannot be null or blank");
        }
        if (domain == null || domain.isBlank()) {
            throw new IllegalArgumentException("domain cannot be null or blank");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId cannot be null or blank");
        }
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    /**
     * 새 correlationId로 이벤트 생성.
     *
     * @param type 이벤트 타입
     * @param domain 도메인
     * @param payload 페이로드
     * @param clock 시각 기준
     * @return DomainEvent
     */
    public static DomainEvent of(String type, String domain, Map<String, Object> payload, Clock clock) {
        return new DomainEvent(type, domain, payload, clock.instant(), UUID.randomUUID().toString());
    }
}
