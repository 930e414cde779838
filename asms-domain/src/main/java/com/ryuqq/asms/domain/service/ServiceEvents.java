package com.ryuqq.asms.domain.service;

import com.ryuqq.asms.core.error.UnitException;
import com.ryuqq.asms.core.event.DomainEvent;
import com.ryuqq.asms.domain.support.Timestamps;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 서비스 도메인 이벤트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ServiceEvents {

    public static final String DOMAIN = "service";
    public static final String CREATED = "service.created";
    public static final String STARTED = "service.started";
    public static final String STOPPED = "service.stopped";
    public static final String SCALED = "service.scaled";
    public static final String FAILED = "service.failed";

    // Utility class - prevent instantiation
    private ServiceEvents() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static DomainEvent created(ModelService service, Clock clock) {
        Map<String, Object> payload = base(service);
        payload.put("replicas", service.replicas());
        payload.put("resource_class", service.resourceClass().getValue());
        payload.put("created_at", Timestamps.format(service.createdAt()));
        return DomainEvent.of(CREATED, DOMAIN, payload, clock);
    }

    public static DomainEvent started(ModelService service, Clock clock) {
        Map<String, Object> payload = base(service);
        payload.put("replicas", service.replicas());
        payload.put("endpoints", service.endpoints());
        payload.put("started_at", Timestamps.format(clock.instant()));
        return DomainEvent.of(STARTED, DOMAIN, payload, clock);
    }

    public static DomainEvent stopped(ModelService service, String reason, Clock clock) {
        Map<String, Object> payload = base(service);
        payload.put("reason", reason);
        payload.put("stopped_at", Timestamps.format(clock.instant()));
        return DomainEvent.of(STOPPED, DOMAIN, payload, clock);
    }

    public static DomainEvent scaled(ModelService service, int oldReplicas, Clock clock) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("service_id", service.id());
        payload.put("model_id", service.modelId());
        payload.put("old_replicas", oldReplicas);
        payload.put("new_replicas", service.replicas());
        payload.put("timestamp", Timestamps.format(clock.instant()));
        return DomainEvent.of(SCALED, DOMAIN, payload, clock);
    }

    public static DomainEvent failed(ModelService service, Throwable error, Clock clock) {
        Map<String, Object> payload = base(service);
        payload.put("error", String.valueOf(error.getMessage()));
        UnitException.find(error).ifPresent(typed -> payload.put("error_code", typed.getCode().getValue()));
        payload.put("timestamp", Timestamps.format(clock.instant()));
        return DomainEvent.of(FAILED, DOMAIN, payload, clock);
    }

    private static Map<String, Object> base(ModelService service) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("service_id", service.id());
        payload.put("model_id", service.modelId());
        payload.put("status", service.status().getValue());
        return payload;
    }
}
