package com.ryuqq.asms.core.event;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unit 실행 생명주기 이벤트.
 *
 * <p>correlationId는 이벤트마다 고유하고, executionId는 한 번의 실행에서 발행되는
 * Started/Completed/Failed가 공유합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param kind 생명주기 단계
 * @param domain 도메인
 * @param unitName Unit 이름
 * @param input 입력 (STARTED에서만)
 * @param output 출력 (COMPLETED에서만)
 * @param error 에러 메시지 (FAILED에서만)
 * @param errorCode 에러 코드 (FAILED에서만, 알 수 있는 경우)
 * @param timestamp 발생 시각
 * @param correlationId 이벤트 식별자
 * @param executionId 실행 식별자
 * @param durationMs 시작부터 경과 시간 (종료 이벤트에서만)
 */
public record ExecutionEvent(
    ExecutionEventType kind,
    String domain,
    String unitName,
    Object input,
    Object output,
    String error,
    String errorCode,
    Instant timestamp,
    String correlationId,
    String executionId,
    Long durationMs
) implements Event {

    public ExecutionEvent {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        if (correlationId == null) {
            throw new IllegalArgumentException("correlationId cannot be null");
        }
    }

    @Override
    public String type() {
        return kind.getValue();
    }

    /**
     * 직렬화 형태의 페이로드.
     *
     * @return event_type, domain, unit_name, input/output/error, timestamp, correlation_id, duration_ms
     */
    @Override
    public Map<String, Object> payload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("event_type", kind.getValue());
        payload.put("domain", domain);
        payload.put("unit_name", unitName);
        if (input != null) {
            payload.put("input", input);
        }
        if (output != null) {
            payload.put("output", output);
        }
        if (error != null) {
            payload.put("error", error);
        }
        if (errorCode != null) {
            payload.put("error_code", errorCode);
        }
        payload.put("timestamp", timestamp.toString());
        payload.put("correlation_id", correlationId);
        payload.put("execution_id", executionId);
        if (durationMs != null) {
            payload.put("duration_ms", durationMs);
        }
        return payload;
    }
}
