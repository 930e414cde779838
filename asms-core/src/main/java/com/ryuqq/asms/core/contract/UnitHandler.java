package com.ryuqq.asms.core.contract;

import com.ryuqq.asms.core.context.CallContext;

import java.util.Map;

/**
 * Unit 비즈니스 로직.
 *
 * <p>입력은 이미 키/값 맵으로 좁혀진 상태로 전달됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface UnitHandler {

    Map<String, Object> handle(CallContext ctx, Map<String, Object> input);
}
