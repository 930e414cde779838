package com.ryuqq.asms.core.registry;

import com.ryuqq.asms.core.contract.Command;
import com.ryuqq.asms.core.contract.Query;
import com.ryuqq.asms.core.contract.Resource;
import com.ryuqq.asms.core.contract.ResourceFactory;
import com.ryuqq.asms.core.contract.Unit;
import com.ryuqq.asms.core.error.ErrorCode;
import com.ryuqq.asms.core.error.UnitException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Unit 및 Resource 레지스트리.
 *
 * <p>Transport는 이 레지스트리로 이름/URI를 Unit/Resource로 해석합니다.
 * 조회는 여러 스레드에서 동시에 가능하고 등록/해제는 배타적으로 수행됩니다.</p>
 *
 * <p><strong>Resource 해석 순서:</strong></p>
 * <ol>
 *   <li>정적으로 등록된 Resource (정확한 URI 일치)</li>
 *   <li>등록 순서대로 {@link ResourceFactory#canCreate(String)}가 true인 첫 팩토리</li>
 * </ol>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class UnitRegistry {

    private static final Logger log = LoggerFactory.getLogger(UnitRegistry.class);

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, Command> commands = new LinkedHashMap<>();
    private final Map<String, Query> queries = new LinkedHashMap<>();
    private final Map<String, Resource> resources = new LinkedHashMap<>();
    private final List<ResourceFactory> factories = new ArrayList<>();

    public void registerCommand(Command command) {
        register(commands, command, "command");
    }

    public void registerQuery(Query query) {
        register(queries, query, "query");
    }

    /**
     * 정적 Resource 등록.
     *
     * @throws UnitException 같은 URI가 이미 등록된 경우 (already_exists)
     */
    public void registerResource(Resource resource) {
        if (resource == null) {
            throw new IllegalArgumentException("resource cannot be null");
        }
        write(() -> {
            if (resources.containsKey(resource.uri())) {
                throw UnitException.of(ErrorCode.ALREADY_EXISTS, "resource already registered: " + resource.uri());
            }
            resources.put(resource.uri(), resource);
            return null;
        });
        log.debug("Registered resource {}", resource.uri());
    }

    public void registerFactory(ResourceFactory factory) {
        if (factory == null) {
            throw new IllegalArgumentException("factory cannot be null");
        }
        write(() -> factories.add(factory));
        log.debug("Registered resource factory {}", factory.pattern());
    }

    public Optional<Command> getCommand(String name) {
        return read(() -> Optional.ofNullable(commands.get(name)));
    }

    public Optional<Query> getQuery(String name) {
        return read(() -> Optional.ofNullable(queries.get(name)));
    }

    /**
     * 이름으로 Command 또는 Query 조회.
     *
     * @param name Unit 이름
     * @return Unit
     * @throws UnitException 등록되지 않은 이름 (unit_not_found)
     */
    public Unit requireUnit(String name) {
        return read(() -> {
            Unit unit = commands.containsKey(name) ? commands.get(name) : queries.get(name);
            if (unit == null) {
                throw UnitException.of(ErrorCode.UNIT_NOT_FOUND, "unit not found: " + name);
            }
            return unit;
        });
    }

    public Optional<Resource> getResource(String uri) {
        return read(() -> Optional.ofNullable(resources.get(uri)));
    }

    /**
     * URI를 Resource로 해석.
     *
     * @param uri 대상 URI
     * @return Resource
     * @throws UnitException 해석할 수 없는 URI (not_found)
     */
    public Resource resolveResource(String uri) {
        ResourceFactory factory = read(() -> {
            if (resources.containsKey(uri)) {
                return null;
            }
            for (ResourceFactory candidate : factories) {
                if (candidate.canCreate(uri)) {
                    return candidate;
                }
            }
            throw UnitException.of(ErrorCode.NOT_FOUND, "resource not found: " + uri);
        });
        if (factory == null) {
            return getResource(uri).orElseThrow(
                () -> UnitException.of(ErrorCode.NOT_FOUND, "resource not found: " + uri));
        }
        return factory.create(uri);
    }

    public List<Command> listCommands() {
        return read(() -> List.copyOf(commands.values()));
    }

    public List<Query> listQueries() {
        return read(() -> List.copyOf(queries.values()));
    }

    public List<Resource> listResources() {
        return read(() -> List.copyOf(resources.values()));
    }

    public List<ResourceFactory> listFactories() {
        return read(() -> List.copyOf(factories));
    }

    public boolean unregisterCommand(String name) {
        return write(() -> commands.remove(name) != null);
    }

    public boolean unregisterQuery(String name) {
        return write(() -> queries.remove(name) != null);
    }

    public boolean unregisterResource(String uri) {
        return write(() -> resources.remove(uri) != null);
    }

    public void clear() {
        write(() -> {
            commands.clear();
            queries.clear();
            resources.clear();
            factories.clear();
            return null;
        });
    }

    private <U extends Unit> void register(Map<String, U> target, U unit, String kind) {
        if (unit == null) {
            throw new IllegalArgumentException(kind + " cannot be null");
        }
        write(() -> {
            if (commands.containsKey(unit.name()) || queries.containsKey(unit.name())) {
                throw UnitException.of(ErrorCode.ALREADY_EXISTS, kind + " already registered: " + unit.name());
            }
            target.put(unit.name(), unit);
            return null;
        });
        log.debug("Registered {} {}", kind, unit.name());
    }

    private <T> T read(Supplier<T> action) {
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    private <T> T write(Supplier<T> action) {
        lock.writeLock().lock();
        try {
            return action.get();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
