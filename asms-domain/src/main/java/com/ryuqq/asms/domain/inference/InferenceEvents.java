package com.ryuqq.asms.domain.inference;

import com.ryuqq.asms.core.event.DomainEvent;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 추론 요청 이벤트.
 *
 * <p>세 이벤트는 같은 {@code request_id}로 묶입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class InferenceEvents {

    public static final String DOMAIN = "inference";
    public static final String REQUEST_STARTED = "inference.request_started";
    public static final String REQUEST_COMPLETED = "inference.request_completed";
    public static final String REQUEST_FAILED = "inference.request_failed";

    // Utility class - prevent instantiation
    private InferenceEvents() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * @param requestType 요청 종류 (예: "chat", "complete")
     */
    public static DomainEvent requestStarted(String requestId, String model, String requestType, Clock clock) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("request_id", requestId);
        payload.put("model", model);
        payload.put("type", requestType);
        return DomainEvent.of(REQUEST_STARTED, DOMAIN, payload, clock);
    }

    public static DomainEvent requestCompleted(String requestId, long durationMs, int totalTokens, Clock clock) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("request_id", requestId);
        payload.put("duration_ms", durationMs);
        payload.put("total_tokens", totalTokens);
        return DomainEvent.of(REQUEST_COMPLETED, DOMAIN, payload, clock);
    }

    public static DomainEvent requestFailed(String requestId, String error, Clock clock) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("request_id", requestId);
        payload.put("error", error);
        return DomainEvent.of(REQUEST_FAILED, DOMAIN, payload, clock);
    }
}
