package com.ryuqq.asms.runtime.watch;

import com.ryuqq.asms.core.context.CallContext;

/**
 * 한 번의 poll tick에서 현재 값을 읽는 함수.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ResourceFetcher {

    Object fetch(CallContext ctx);
}
