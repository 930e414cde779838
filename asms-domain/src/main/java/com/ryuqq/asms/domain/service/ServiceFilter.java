package com.ryuqq.asms.domain.service;

/**
 * 서비스 조회 필터.
 *
 * <p>status와 modelId는 AND로 결합되며 null이면 조건 없음입니다.
 * offset은 필터 결과 길이로 잘리고, limit 0은 무제한입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param status 상태 (nullable)
 * @param modelId 모델 ID (nullable)
 * @param limit 최대 개수 (0 = 무제한)
 * @param offset 시작 위치
 */
public record ServiceFilter(ServiceStatus status, String modelId, int limit, int offset) {

    public static final ServiceFilter ALL = new ServiceFilter(null, null, 0, 0);

    public ServiceFilter {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be non-negative (current: " + limit + ")");
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be non-negative (current: " + offset + ")");
        }
        modelId = modelId == null || modelId.isEmpty() ? null : modelId;
    }

    public boolean matches(ModelService service) {
        return (status == null || status == service.status())
            && (modelId == null || modelId.equals(service.modelId()));
    }
}
