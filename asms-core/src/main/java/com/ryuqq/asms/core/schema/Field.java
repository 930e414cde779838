package com.ryuqq.asms.core.schema;

/**
 * 객체 스키마의 프로퍼티.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param name 프로퍼티 이름
 * @param schema 프로퍼티 스키마
 */
public record Field(String name, Schema schema) {

    public Field {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (schema == null) {
            throw new IllegalArgumentException("schema cannot be null");
        }
    }

    public static Field of(String name, Schema schema) {
        return new Field(name, schema);
    }
}
