package com.ryuqq.asms.domain.inference;

/**
 * 텍스트 완성 스트림 조각.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param id 응답 ID
 * @param model 모델 ID
 * @param text 텍스트 조각
 * @param finishReason 종료 사유 (마지막 조각 외에는 null)
 * @param usage 토큰 사용량 (nullable)
 */
public record CompleteStreamChunk(String id, String model, String text, String finishReason, Usage usage) {
}
