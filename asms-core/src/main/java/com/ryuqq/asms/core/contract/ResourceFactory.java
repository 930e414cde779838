package com.ryuqq.asms.core.contract;

/**
 * 동적 URI에 대한 Resource 생성기.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ResourceFactory {

    /**
     * 처리 가능한 URI인지 확인.
     */
    boolean canCreate(String uri);

    /**
     * Resource 생성.
     *
     * @param uri 대상 URI
     * @return Resource
     * @throws com.ryuqq.asms.core.error.UnitException URI를 해석할 수 없는 경우 (invalid_input)
     */
    Resource create(String uri);

    /**
     * 사람이 읽을 수 있는 URI 패턴 (예: "asms://device/{id}/{type}").
     */
    String pattern();
}
