package com.ryuqq.asms.domain.service;

import com.ryuqq.asms.core.context.CallContext;
import com.ryuqq.asms.core.contract.ResourceOperation;
import com.ryuqq.asms.core.contract.ResourceUris;
import com.ryuqq.asms.core.error.UnitException;
import com.ryuqq.asms.runtime.watch.AbstractPollingResource;
import com.ryuqq.asms.runtime.watch.ChangeDetector;
import com.ryuqq.asms.runtime.watch.ResourcePoller;
import com.ryuqq.asms.runtime.watch.WatchConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 단일 서비스 Resource ({@code asms://service/<id>}).
 *
 * <p>이전 tick과 status가 다르면 {@code status_changed}, 아니면 {@code refresh}를 전달합니다.
 * 첫 tick은 {@code refresh}입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ServiceResource extends AbstractPollingResource {

    public static final String PREFIX = ResourceUris.of(ServiceEvents.DOMAIN, "");

    private static final Logger log = LoggerFactory.getLogger(ServiceResource.class);

    private final String serviceId;
    private final ServiceStore store;

    public ServiceResource(String serviceId, ServiceStore store, ResourcePoller poller, WatchConfig config) {
        super(uriOf(serviceId), ServiceEvents.DOMAIN, ServiceQueries.SERVICE_SCHEMA, poller,
            config.serviceIntervalMs(), config.bufferCapacity());
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        this.serviceId = serviceId;
        this.store = store;
    }

    public static String uriOf(String serviceId) {
        if (serviceId == null || serviceId.isEmpty() || serviceId.contains("/")) {
            throw new IllegalArgumentException("serviceId must be non-empty and free of '/' (current: "
                + serviceId + ")");
        }
        return PREFIX + serviceId;
    }

    public String serviceId() {
        return serviceId;
    }

    @Override
    public Object get(CallContext ctx) {
        try {
            return ServiceViews.service(store.get(ctx, serviceId));
        } catch (UnitException e) {
            throw UnitException.wrap("get service " + serviceId, e);
        }
    }

    @Override
    protected ChangeDetector newChangeDetector() {
        return ChangeDetector.onFieldChange("status", ResourceOperation.STATUS_CHANGED, (previous, current) ->
            log.info("Service {} status changed: {} -> {}", serviceId, previous, current));
    }
}
