package com.ryuqq.asms.domain.inference;

/**
 * 텍스트 완성 응답.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param text 생성된 텍스트
 * @param finishReason 종료 사유
 * @param usage 토큰 사용량
 */
public record CompletionResponse(String text, String finishReason, Usage usage) {

    public CompletionResponse {
        usage = usage == null ? Usage.EMPTY : usage;
    }
}
