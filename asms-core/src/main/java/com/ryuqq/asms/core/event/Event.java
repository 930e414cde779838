package com.ryuqq.asms.core.event;

import java.time.Instant;
import java.util.Map;

/**
 * 불변 이벤트 계약.
 *
 * <p>correlationId는 이벤트마다 고유합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Event {

    /**
     * 이벤트 타입 (예: "alert.acknowledged", "execution_started").
     */
    String type();

    String domain();

    /**
     * 이벤트 페이로드 (키/값 맵).
     */
    Map<String, Object> payload();

    Instant timestamp();

    String correlationId();
}
