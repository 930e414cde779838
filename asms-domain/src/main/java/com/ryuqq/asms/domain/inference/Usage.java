package com.ryuqq.asms.domain.inference;

/**
 * 토큰 사용량.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param promptTokens 입력 토큰 수
 * @param completionTokens 출력 토큰 수
 * @param totalTokens 합계
 */
public record Usage(int promptTokens, int completionTokens, int totalTokens) {

    public static final Usage EMPTY = new Usage(0, 0, 0);

    public Usage {
        if (promptTokens < 0 || completionTokens < 0 || totalTokens < 0) {
            throw new IllegalArgumentException("token counts cannot be negative");
        }
    }

    /**
     * 합계를 계산해서 생성.
     */
    public static Usage of(int promptTokens, int completionTokens) {
        return new Usage(promptTokens, completionTokens, promptTokens + completionTokens);
    }
}
