package com.ryuqq.asms.domain.inference;

/**
 * 채팅 응답.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param content 생성된 내용
 * @param finishReason 종료 사유 (예: "stop")
 * @param usage 토큰 사용량
 * @param model 모델 ID
 * @param id 응답 ID
 */
public record ChatResponse(String content, String finishReason, Usage usage, String model, String id) {

    public ChatResponse {
        usage = usage == null ? Usage.EMPTY : usage;
    }
}
