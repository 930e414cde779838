package com.ryuqq.asms.domain.inference;

/**
 * 음성 합성 목소리.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param id 목소리 ID
 * @param name 표시 이름
 * @param language 언어 코드
 * @param gender 성별 (빈 문자열 가능)
 * @param description 설명
 */
public record Voice(String id, String name, String language, String gender, String description) {
}
