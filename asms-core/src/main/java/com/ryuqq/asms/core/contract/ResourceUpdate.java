package com.ryuqq.asms.core.contract;

import java.time.Instant;

/**
 * Watch 채널로 전달되는 변경 알림.
 *
 * <p>operation이 {@link ResourceOperation#ERROR}이면 error가 채워지고 data는 null입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param uri Resource URI
 * @param timestamp 관측 시각
 * @param operation 변경 종류
 * @param data 최신 값 (nullable)
 * @param error 조회 실패 원인 (nullable)
 */
public record ResourceUpdate(
    String uri,
    Instant timestamp,
    ResourceOperation operation,
    Object data,
    Throwable error
) {

    public ResourceUpdate {
        if (uri == null || uri.isBlank()) {
            throw new IllegalArgumentException("uri cannot be null or blank");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
    }

    public static ResourceUpdate of(String uri, Instant timestamp, ResourceOperation operation, Object data) {
        return new ResourceUpdate(uri, timestamp, operation, data, null);
    }

    public static ResourceUpdate error(String uri, Instant timestamp, Throwable error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        return new ResourceUpdate(uri, timestamp, ResourceOperation.ERROR, null, error);
    }

    public boolean isError() {
        return operation == ResourceOperation.ERROR;
    }
}
