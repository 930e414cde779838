package com.ryuqq.asms.domain.device;

import com.ryuqq.asms.core.contract.Resource;
import com.ryuqq.asms.core.contract.ResourceFactory;
import com.ryuqq.asms.core.error.ErrorCode;
import com.ryuqq.asms.core.error.UnitException;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@code asms://device/*} Resource 팩토리.
 *
 * <p>URI별 인스턴스를 캐시합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DeviceResourceFactory implements ResourceFactory {

    private final DeviceResources resources;
    private final Map<DeviceResourceUri, Resource> cache = new ConcurrentHashMap<>();

    public DeviceResourceFactory(DeviceResources resources) {
        if (resources == null) {
            throw new IllegalArgumentException("resources cannot be null");
        }
        this.resources = resources;
    }

    @Override
    public boolean canCreate(String uri) {
        return DeviceResourceUri.parse(uri).isPresent();
    }

    @Override
    public Resource create(String uri) {
        DeviceResourceUri parsed = DeviceResourceUri.parse(uri).orElseThrow(() ->
            UnitException.of(DeviceEvents.DOMAIN, ErrorCode.NOT_FOUND, "invalid device resource uri: " + uri));
        return cache.computeIfAbsent(parsed, resources::create);
    }

    @Override
    public String pattern() {
        return DeviceResourceUri.PREFIX + "*";
    }
}
