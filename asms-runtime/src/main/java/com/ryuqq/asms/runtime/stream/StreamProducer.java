package com.ryuqq.asms.runtime.stream;

import com.ryuqq.asms.core.context.CallContext;

/**
 * Provider-side stream. Returns once every item has been sent.
 *
 * @param <T> item type
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface StreamProducer<T> {

    void produce(CallContext ctx, StreamSink<T> sink);
}
