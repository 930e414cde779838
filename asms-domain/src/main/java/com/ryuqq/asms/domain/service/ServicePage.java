package com.ryuqq.asms.domain.service;

import java.util.List;

/**
 * 서비스 페이지 조회 결과.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param services 페이지 내 서비스
 * @param total 페이지 적용 전 필터 결과 개수
 */
public record ServicePage(List<ModelService> services, int total) {

    public ServicePage {
        services = services == null ? List.of() : List.copyOf(services);
        if (total < services.size()) {
            throw new IllegalArgumentException("total must not be less than page size (total: " + total + ")");
        }
    }
}
