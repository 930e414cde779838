package com.ryuqq.asms.domain.service;

import com.ryuqq.asms.core.context.CallContext;
import com.ryuqq.asms.core.error.ErrorCode;
import com.ryuqq.asms.core.error.UnitException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 메모리 기반 ServiceStore.
 *
 * <p>create/update/delete는 write lock, get/list는 read lock으로 보호됩니다.
 * 목록은 생성 순서를 따릅니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class InMemoryServiceStore implements ServiceStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryServiceStore.class);

    private final Clock clock;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, ModelService> services = new LinkedHashMap<>();

    public InMemoryServiceStore() {
        this(Clock.systemUTC());
    }

    public InMemoryServiceStore(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    @Override
    public ModelService create(CallContext ctx, ModelService service) {
        ctx.throwIfDone();
        requireService(service);
        lock.writeLock().lock();
        try {
            if (services.containsKey(service.id())) {
                throw UnitException.of(ServiceEvents.DOMAIN, ErrorCode.ALREADY_EXISTS,
                    "service already exists: " + service.id());
            }
            Instant now = clock.instant();
            ModelService stored = service.withTimestamps(now, now);
            services.put(stored.id(), stored);
            log.debug("Created service {} for model {}", stored.id(), stored.modelId());
            return stored;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public ModelService get(CallContext ctx, String id) {
        ctx.throwIfDone();
        lock.readLock().lock();
        try {
            ModelService service = services.get(id);
            if (service == null) {
                throw notFound(id);
            }
            return service;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public ModelService getByName(CallContext ctx, String name) {
        ctx.throwIfDone();
        lock.readLock().lock();
        try {
            for (ModelService service : services.values()) {
                if (service.name().equals(name)) {
                    return service;
                }
            }
            throw UnitException.of(ServiceEvents.DOMAIN, ErrorCode.SERVICE_NOT_FOUND,
                "service not found by name: " + name);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public ServicePage list(CallContext ctx, ServiceFilter filter) {
        ctx.throwIfDone();
        ServiceFilter effective = filter == null ? ServiceFilter.ALL : filter;
        List<ModelService> matched = new ArrayList<>();
        lock.readLock().lock();
        try {
            for (ModelService service : services.values()) {
                if (effective.matches(service)) {
                    matched.add(service);
                }
            }
        } finally {
            lock.readLock().unlock();
        }

        int total = matched.size();
        int from = Math.min(effective.offset(), total);
        int to = effective.limit() > 0 ? Math.min(from + effective.limit(), total) : total;
        return new ServicePage(matched.subList(from, to), total);
    }

    @Override
    public ModelService update(CallContext ctx, ModelService service) {
        ctx.throwIfDone();
        requireService(service);
        lock.writeLock().lock();
        try {
            ModelService existing = services.get(service.id());
            if (existing == null) {
                throw notFound(service.id());
            }
            Instant now = clock.instant();
            Instant updatedAt = now.isBefore(existing.createdAt()) ? existing.createdAt() : now;
            ModelService stored = service.withTimestamps(existing.createdAt(), updatedAt);
            services.put(stored.id(), stored);
            return stored;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void delete(CallContext ctx, String id) {
        ctx.throwIfDone();
        lock.writeLock().lock();
        try {
            if (services.remove(id) == null) {
                throw notFound(id);
            }
            log.debug("Deleted service {}", id);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private static void requireService(ModelService service) {
        if (service == null || service.id().isEmpty()) {
            throw UnitException.of(ServiceEvents.DOMAIN, ErrorCode.INVALID_INPUT, "invalid service: missing id");
        }
    }

    private static UnitException notFound(String id) {
        return UnitException.of(ServiceEvents.DOMAIN, ErrorCode.SERVICE_NOT_FOUND, "service not found: " + id);
    }
}
