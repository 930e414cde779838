package com.ryuqq.asms.domain.inference;

import java.util.List;

/**
 * 재순위화 응답.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param results 결과 목록
 * @param usage 토큰 사용량
 */
public record RerankResponse(List<RerankResult> results, Usage usage) {

    public RerankResponse {
        results = results == null ? List.of() : List.copyOf(results);
        usage = usage == null ? Usage.EMPTY : usage;
    }
}
