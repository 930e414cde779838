package com.ryuqq.asms.core.contract;

import com.ryuqq.asms.core.schema.Schema;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Unit 메타데이터.
 *
 * <p><strong>식별자 규칙:</strong> name은 {@code <domain>.<verb>} 형태이며 접두사가 domain과 일치해야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param name Unit 이름 (예: "alert.create_rule")
 * @param domain 도메인 (예: "alert")
 * @param description 설명
 * @param inputSchema 입력 스키마
 * @param outputSchema 출력 스키마
 * @param examples 문서용 예시
 */
public record UnitDescriptor(
    String name,
    String domain,
    String description,
    Schema inputSchema,
    Schema outputSchema,
    List<Example> examples
) {

    private static final Pattern NAME_PATTERN = Pattern.compile("^[a-z][a-z0-9_]*\\.[a-z][a-z0-9_]*$");

    public UnitDescriptor {
        if (name == null || !NAME_PATTERN.matcher(name).matches()) {
            throw new IllegalArgumentException("name must be <domain>.<verb> (current: " + name + ")");
        }
        if (domain == null || !name.startsWith(domain + ".")) {
            throw new IllegalArgumentException("name " + name + " must start with domain " + domain);
        }
        if (description == null) {
            throw new IllegalArgumentException("description cannot be null");
        }
        if (inputSchema == null) {
            throw new IllegalArgumentException("inputSchema cannot be null");
        }
        if (outputSchema == null) {
            throw new IllegalArgumentException("outputSchema cannot be null");
        }
        examples = examples == null ? List.of() : List.copyOf(examples);
    }

    public static UnitDescriptor of(
        String name,
        String description,
        Schema inputSchema,
        Schema outputSchema,
        List<Example> examples
    ) {
        String domain = name == null ? null : name.substring(0, Math.max(0, name.indexOf('.')));
        return new UnitDescriptor(name, domain, description, inputSchema, outputSchema, examples);
    }

    /**
     * 도메인 접두사를 뗀 동사 부분.
     */
    public String verb() {
        return name.substring(domain.length() + 1);
    }
}
