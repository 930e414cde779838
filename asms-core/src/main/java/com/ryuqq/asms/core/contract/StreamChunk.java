package com.ryuqq.asms.core.contract;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 호출자에게 전달되는 스트림 프레임.
 *
 * <p>콘텐츠 프레임은 type="content"입니다. 스트림 종료는 프레임이 아니라
 * {@link StreamingCommand#executeStream}의 반환(또는 예외)으로 표현됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param type 프레임 타입
 * @param data 프레임 데이터
 * @param metadata 메타데이터 (finish_reason, model, id 등)
 */
public record StreamChunk(String type, Object data, Map<String, Object> metadata) {

    public static final String TYPE_CONTENT = "content";

    public StreamChunk {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type cannot be null or blank");
        }
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static StreamChunk content(Object data, Map<String, Object> metadata) {
        return new StreamChunk(TYPE_CONTENT, data, metadata);
    }
}
