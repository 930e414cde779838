package com.ryuqq.asms.domain.service;

import com.ryuqq.asms.core.contract.Resource;
import com.ryuqq.asms.core.contract.ResourceFactory;
import com.ryuqq.asms.core.contract.ResourceUris;
import com.ryuqq.asms.core.error.ErrorCode;
import com.ryuqq.asms.core.error.UnitException;
import com.ryuqq.asms.runtime.watch.ResourcePoller;
import com.ryuqq.asms.runtime.watch.WatchConfig;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@code asms://services}, {@code asms://service/*} Resource 팩토리.
 *
 * <p>서비스별 인스턴스를 캐시하므로 같은 URI의 구독자는 하나의 poll 작업을 공유합니다.
 * 존재하지 않는 서비스도 Resource는 만들어지며, 읽기 시 {@code service_not_found}로 실패합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ServiceResourceFactory implements ResourceFactory {

    private final ServiceStore store;
    private final ResourcePoller poller;
    private final WatchConfig config;
    private final ServicesResource services;
    private final Map<String, ServiceResource> cache = new ConcurrentHashMap<>();

    public ServiceResourceFactory(ServiceStore store, ServicesResource services, ResourcePoller poller,
                                  WatchConfig config) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (services == null) {
            throw new IllegalArgumentException("services cannot be null");
        }
        if (poller == null) {
            throw new IllegalArgumentException("poller cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.store = store;
        this.services = services;
        this.poller = poller;
        this.config = config;
    }

    @Override
    public boolean canCreate(String uri) {
        return ServicesResource.URI.equals(uri) || serviceIdOf(uri) != null;
    }

    @Override
    public Resource create(String uri) {
        if (ServicesResource.URI.equals(uri)) {
            return services;
        }
        String serviceId = serviceIdOf(uri);
        if (serviceId == null) {
            throw UnitException.of(ServiceEvents.DOMAIN, ErrorCode.NOT_FOUND, "invalid service resource uri: " + uri);
        }
        return cache.computeIfAbsent(serviceId, id -> new ServiceResource(id, store, poller, config));
    }

    @Override
    public String pattern() {
        return ServiceResource.PREFIX + "*";
    }

    private static String serviceIdOf(String uri) {
        String serviceId = ResourceUris.stripPrefix(uri, ServiceResource.PREFIX);
        return serviceId == null || serviceId.isEmpty() || serviceId.contains("/") ? null : serviceId;
    }
}
