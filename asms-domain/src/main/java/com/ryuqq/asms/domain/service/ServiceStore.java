package com.ryuqq.asms.domain.service;

import com.ryuqq.asms.core.context.CallContext;

/**
 * 서비스 저장소.
 *
 * <p>모든 메서드는 호출 컨텍스트가 종료되었으면 취소 예외를 던집니다.
 * 존재하지 않는 서비스는 {@code service_not_found}로 실패합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ServiceStore {

    /**
     * 서비스 저장. createdAt/updatedAt을 현재 시각으로 설정합니다.
     *
     * @throws com.ryuqq.asms.core.error.UnitException ID 충돌 시 (already_exists)
     */
    ModelService create(CallContext ctx, ModelService service);

    ModelService get(CallContext ctx, String id);

    ModelService getByName(CallContext ctx, String name);

    /**
     * 필터 + 페이지 조회. total은 페이지 적용 전 개수입니다.
     */
    ServicePage list(CallContext ctx, ServiceFilter filter);

    /**
     * 서비스 갱신. createdAt은 유지하고 updatedAt을 갱신합니다.
     */
    ModelService update(CallContext ctx, ModelService service);

    void delete(CallContext ctx, String id);
}
