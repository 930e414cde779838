package com.ryuqq.asms.domain.inference;

import java.util.List;

/**
 * 추론 모델 정보.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param id 모델 ID
 * @param name 표시 이름
 * @param type 모델 종류
 * @param provider 제공자 (예: "ollama")
 * @param description 설명
 * @param maxTokens 최대 토큰 (0이면 해당 없음)
 * @param modalities 지원 modality
 */
public record InferenceModel(
    String id,
    String name,
    ModelType type,
    String provider,
    String description,
    int maxTokens,
    List<String> modalities
) {

    public InferenceModel {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        description = description == null ? "" : description;
        modalities = modalities == null ? List.of() : List.copyOf(modalities);
    }

    public static InferenceModel of(String id, String name, ModelType type, String provider, int maxTokens) {
        return new InferenceModel(id, name, type, provider, "", maxTokens, List.of());
    }
}
