package com.ryuqq.asms.domain.inference;

/**
 * 채팅 스트림 조각. 마지막 조각은 비어 있지 않은 finishReason을 가집니다.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param id 응답 ID
 * @param model 모델 ID
 * @param content 내용 조각
 * @param finishReason 종료 사유 (마지막 조각 외에는 null)
 * @param usage 토큰 사용량 (nullable)
 */
public record ChatStreamChunk(String id, String model, String content, String finishReason, Usage usage) {
}
