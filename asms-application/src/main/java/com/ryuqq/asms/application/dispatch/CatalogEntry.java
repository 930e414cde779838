package com.ryuqq.asms.application.dispatch;

/**
 * 카탈로그 항목 (Unit 또는 Resource).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param name Unit 이름 또는 Resource URI (팩토리는 URI 패턴)
 * @param type 항목 종류
 * @param domain 도메인 (팩토리는 null)
 * @param description 설명 (Resource는 빈 문자열)
 * @param streaming 스트리밍 지원 여부
 */
public record CatalogEntry(String name, Type type, String domain, String description, boolean streaming) {

    public CatalogEntry {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        description = description == null ? "" : description;
    }

    /**
     * 항목 종류.
     */
    public enum Type {
        COMMAND,
        QUERY,
        RESOURCE,
        RESOURCE_PATTERN
    }
}
