package com.ryuqq.asms.domain.service;

import com.ryuqq.asms.core.context.CallContext;

/**
 * 서비스 실행 backend.
 *
 * <p>구현체는 컨텍스트 취소를 모든 blocking 지점에서 확인해야 합니다.
 * 실패는 {@link com.ryuqq.asms.core.error.UnitException}으로 전달합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ServiceProvider {

    /**
     * 서비스 배치를 생성합니다. 반환된 서비스의 ID와 endpoint가 저장소에 기록됩니다.
     */
    ModelService create(CallContext ctx, String modelId, ResourceClass resourceClass, int replicas,
                        boolean persistent);

    void start(CallContext ctx, String serviceId);

    void stop(CallContext ctx, String serviceId, boolean force);

    void scale(CallContext ctx, String serviceId, int replicas);

    ServiceMetrics getMetrics(CallContext ctx, String serviceId);

    /**
     * @param hint 선택적 힌트 (예: high-throughput, cost-effective), 빈 문자열 허용
     */
    Recommendation getRecommendation(CallContext ctx, String modelId, String hint);

    /**
     * backend에서 서비스가 실제로 실행 중인지 확인합니다.
     */
    boolean isRunning(CallContext ctx, String serviceId);
}
