package com.ryuqq.asms.domain.inference;

/**
 * 재순위화 결과 하나.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param document 문서
 * @param score 관련도 점수
 * @param index 입력 목록에서의 위치
 */
public record RerankResult(String document, double score, int index) {
}
