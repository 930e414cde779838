package com.ryuqq.asms.runtime.watch;

import com.ryuqq.asms.core.context.CallContext;
import com.ryuqq.asms.core.contract.Resource;
import com.ryuqq.asms.core.contract.ResourceWatch;
import com.ryuqq.asms.core.schema.Schema;

/**
 * 구독자마다 독립된 poll 작업을 가지는 Resource 기반 클래스.
 *
 * <p>하위 클래스는 {@link #get(CallContext)}와 {@link #newChangeDetector()}만 구현합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class AbstractPollingResource implements Resource {

    private final String uri;
    private final String domain;
    private final Schema schema;
    private final ResourcePoller poller;
    private final long intervalMs;
    private final int capacity;

    protected AbstractPollingResource(
        String uri,
        String domain,
        Schema schema,
        ResourcePoller poller,
        long intervalMs,
        int capacity
    ) {
        if (uri == null || uri.isBlank()) {
            throw new IllegalArgumentException("uri cannot be null or blank");
        }
        if (poller == null) {
            throw new IllegalArgumentException("poller cannot be null");
        }
        this.uri = uri;
        this.domain = domain;
        this.schema = schema;
        this.poller = poller;
        this.intervalMs = intervalMs;
        this.capacity = capacity;
    }

    @Override
    public String uri() {
        return uri;
    }

    @Override
    public String domain() {
        return domain;
    }

    @Override
    public Schema schema() {
        return schema;
    }

    @Override
    public ResourceWatch watch(CallContext ctx) {
        return poller.watch(ctx, uri, intervalMs, this::get, newChangeDetector(), capacity);
    }

    /**
     * 구독마다 호출되어 새 감지기를 반환.
     */
    protected abstract ChangeDetector newChangeDetector();

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + uri + "]";
    }
}
