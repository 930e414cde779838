package com.ryuqq.asms.domain.inference;

import java.util.List;

/**
 * 텍스트 완성 옵션. null 값은 provider 기본값.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param temperature 샘플링 온도
 * @param maxTokens 최대 출력 토큰
 * @param topP nucleus sampling
 * @param stop 중단 시퀀스
 */
public record CompleteOptions(Double temperature, Integer maxTokens, Double topP, List<String> stop) {

    public static final CompleteOptions DEFAULT = new CompleteOptions(null, null, null, List.of());

    public CompleteOptions {
        stop = stop == null ? List.of() : List.copyOf(stop);
    }
}
