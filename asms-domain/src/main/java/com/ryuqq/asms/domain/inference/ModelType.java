package com.ryuqq.asms.domain.inference;

import java.util.Optional;

/**
 * 추론 모델 종류.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ModelType {

    LLM("llm"),
    ASR("asr"),
    TTS("tts"),
    EMBEDDING("embedding"),
    DIFFUSION("diffusion"),
    VIDEO_GEN("video_gen"),
    DETECTION("detection"),
    RERANK("rerank");

    private final String value;

    ModelType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * 문자열 값으로 조회.
     *
     * @param value 모델 종류 문자열 (예: "llm")
     * @return 일치하는 ModelType, 없으면 empty
     */
    public static Optional<ModelType> fromValue(String value) {
        for (ModelType type : values()) {
            if (type.value.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    static Object[] tokens() {
        ModelType[] types = values();
        Object[] tokens = new Object[types.length];
        for (int i = 0; i < types.length; i++) {
            tokens[i] = types[i].value;
        }
        return tokens;
    }
}
