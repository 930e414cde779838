package com.ryuqq.asms.domain.inference;

import java.util.List;

/**
 * 채팅 옵션.
 *
 * <p>null 값은 provider 기본값을 사용한다는 뜻입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param temperature 샘플링 온도
 * @param maxTokens 최대 출력 토큰
 * @param topP nucleus sampling
 * @param topK top-k sampling
 * @param frequencyPenalty 빈도 패널티
 * @param presencePenalty 존재 패널티
 * @param stop 중단 시퀀스
 */
public record ChatOptions(
    Double temperature,
    Integer maxTokens,
    Double topP,
    Integer topK,
    Double frequencyPenalty,
    Double presencePenalty,
    List<String> stop
) {

    public static final ChatOptions DEFAULT = new ChatOptions(null, null, null, null, null, null, List.of());

    public ChatOptions {
        stop = stop == null ? List.of() : List.copyOf(stop);
    }

    public ChatOptions withTemperature(Double temperature) {
        return new ChatOptions(temperature, maxTokens, topP, topK, frequencyPenalty, presencePenalty, stop);
    }

    public ChatOptions withMaxTokens(Integer maxTokens) {
        return new ChatOptions(temperature, maxTokens, topP, topK, frequencyPenalty, presencePenalty, stop);
    }
}
