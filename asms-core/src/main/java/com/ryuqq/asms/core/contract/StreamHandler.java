package com.ryuqq.asms.core.contract;

import com.ryuqq.asms.core.context.CallContext;

import java.util.Map;
import java.util.concurrent.BlockingQueue;

/**
 * Streaming unit business logic.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface StreamHandler {

    void handle(CallContext ctx, Map<String, Object> input, BlockingQueue<StreamChunk> outbound);
}
