package com.ryuqq.asms.domain.inference;

import java.util.List;

/**
 * 임베딩 응답. 입력 텍스트마다 벡터 하나.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param embeddings 벡터 목록
 * @param usage 토큰 사용량
 */
public record EmbeddingResponse(List<List<Double>> embeddings, Usage usage) {

    public EmbeddingResponse {
        embeddings = embeddings == null ? List.of() : embeddings.stream().map(List::copyOf).toList();
        usage = usage == null ? Usage.EMPTY : usage;
    }
}
