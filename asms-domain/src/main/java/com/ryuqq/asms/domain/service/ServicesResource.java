package com.ryuqq.asms.domain.service;

import com.ryuqq.asms.core.context.CallContext;
import com.ryuqq.asms.core.contract.ResourceOperation;
import com.ryuqq.asms.core.contract.ResourceUris;
import com.ryuqq.asms.core.error.UnitException;
import com.ryuqq.asms.runtime.watch.AbstractPollingResource;
import com.ryuqq.asms.runtime.watch.ChangeDetector;
import com.ryuqq.asms.runtime.watch.ResourcePoller;
import com.ryuqq.asms.runtime.watch.WatchConfig;

/**
 * 서비스 목록 Resource ({@code asms://services}). 비교 없이 매 tick마다 {@code refresh}.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ServicesResource extends AbstractPollingResource {

    public static final String URI = ResourceUris.SCHEME + "services";

    static final int SNAPSHOT_LIMIT = 1000;

    private final ServiceStore store;

    public ServicesResource(ServiceStore store, ResourcePoller poller, WatchConfig config) {
        super(URI, ServiceEvents.DOMAIN, ServiceQueries.SERVICES_SCHEMA, poller, config.servicesListIntervalMs(),
            config.bufferCapacity());
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        this.store = store;
    }

    @Override
    public Object get(CallContext ctx) {
        try {
            return ServiceViews.page(store.list(ctx, new ServiceFilter(null, null, SNAPSHOT_LIMIT, 0)));
        } catch (UnitException e) {
            throw UnitException.wrap("list services", e);
        }
    }

    @Override
    protected ChangeDetector newChangeDetector() {
        return ChangeDetector.always(ResourceOperation.REFRESH);
    }
}
