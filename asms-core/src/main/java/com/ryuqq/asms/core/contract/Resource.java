package com.ryuqq.asms.core.contract;

import com.ryuqq.asms.core.context.CallContext;
import com.ryuqq.asms.core.schema.Schema;

/**
 * URI로 식별되는 읽기 및 구독 가능한 상태.
 *
 * <p>URI 형식: {@code asms://<domain>/<path>}</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Resource {

    String uri();

    String domain();

    Schema schema();

    /**
     * 현재 값 조회.
     *
     * @param ctx 취소 토큰
     * @return 현재 값
     */
    Object get(CallContext ctx);

    /**
     * 변경 구독.
     *
     * <p>구독은 컨텍스트 종료 또는 반환된 watch의 취소로 끝납니다.</p>
     *
     * @param ctx 취소 토큰
     * @return watch 핸들
     */
    ResourceWatch watch(CallContext ctx);
}
