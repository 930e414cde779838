package com.ryuqq.asms.core.schema;

/**
 * 스키마 노드 타입.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum SchemaType {

    OBJECT("object"),
    ARRAY("array"),
    STRING("string"),
    NUMBER("number"),
    BOOLEAN("boolean");

    private final String value;

    SchemaType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * 문자열 토큰으로 타입 조회.
     *
     * @param value 타입 토큰 (예: "object")
     * @return SchemaType
     * @throws IllegalArgumentException 알 수 없는 토큰인 경우
     */
    public static SchemaType fromValue(String value) {
        for (SchemaType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("unknown schema type: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
