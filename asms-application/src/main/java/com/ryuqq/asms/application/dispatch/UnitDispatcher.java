package com.ryuqq.asms.application.dispatch;

import com.ryuqq.asms.core.context.CallContext;
import com.ryuqq.asms.core.contract.Command;
import com.ryuqq.asms.core.contract.Query;
import com.ryuqq.asms.core.contract.Resource;
import com.ryuqq.asms.core.contract.ResourceFactory;
import com.ryuqq.asms.core.contract.ResourceWatch;
import com.ryuqq.asms.core.contract.StreamChunk;
import com.ryuqq.asms.core.contract.StreamingCommand;
import com.ryuqq.asms.core.contract.Unit;
import com.ryuqq.asms.core.error.ErrorCode;
import com.ryuqq.asms.core.error.ErrorResponse;
import com.ryuqq.asms.core.error.UnitException;
import com.ryuqq.asms.core.registry.UnitRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;

/**
 * {@link UnitRegistry} 기반 Dispatcher 구현체.
 *
 * <p><strong>execute 처리 흐름:</strong></p>
 * <ol>
 *   <li>이름으로 Command, 없으면 Query 조회 (둘 다 없으면 unit_not_found)</li>
 *   <li>null 입력은 빈 객체로 치환</li>
 *   <li>입력 스키마 검증 (validateInput)</li>
 *   <li>Unit 실행 (예외는 그대로 전파)</li>
 *   <li>출력 스키마 검증 (validateOutput, 실패 시 validation_failed)</li>
 * </ol>
 *
 * <p>Dispatcher 자체는 상태가 없으므로 여러 스레드에서 동시에 사용할 수 있습니다.
 * 동시성 보장은 레지스트리와 각 Unit이 담당합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class UnitDispatcher implements Dispatcher {

    private static final Logger log = LoggerFactory.getLogger(UnitDispatcher.class);

    private final UnitRegistry registry;
    private final DispatchConfig config;

    public UnitDispatcher(UnitRegistry registry) {
        this(registry, new DispatchConfig());
    }

    public UnitDispatcher(UnitRegistry registry, DispatchConfig config) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.registry = registry;
        this.config = config;
    }

    @Override
    public Map<String, Object> execute(CallContext ctx, String unitName, Object input) {
        Unit unit = lookup(unitName);
        Object normalized = normalize(input);
        if (config.validateInput()) {
            unit.inputSchema().validate(normalized);
        }

        log.debug("Dispatching {} {}", unit.kind(), unitName);
        Map<String, Object> output = unit.execute(ctx, normalized);

        if (config.validateOutput()) {
            validateOutput(unit, output);
        }
        return output;
    }

    @Override
    public void executeStream(CallContext ctx, String unitName, Object input, BlockingQueue<StreamChunk> outbound) {
        if (outbound == null) {
            throw new IllegalArgumentException("outbound cannot be null");
        }
        Command command = registry.getCommand(unitName).orElse(null);
        if (command == null) {
            if (registry.getQuery(unitName).isPresent()) {
                throw UnitException.of(ErrorCode.INVALID_INPUT, "unit does not support streaming: " + unitName);
            }
            throw UnitException.of(ErrorCode.UNIT_NOT_FOUND, "unit not found: " + unitName);
        }
        if (!command.supportsStreaming() || !(command instanceof StreamingCommand streaming)) {
            throw UnitException.of(command.domain(), ErrorCode.INVALID_INPUT,
                "unit does not support streaming: " + unitName);
        }

        Object normalized = normalize(input);
        if (config.validateInput()) {
            streaming.inputSchema().validate(normalized);
        }
        log.debug("Dispatching stream {}", unitName);
        streaming.executeStream(ctx, normalized, outbound);
    }

    @Override
    public Object read(CallContext ctx, String uri) {
        return registry.resolveResource(uri).get(ctx);
    }

    @Override
    public ResourceWatch watch(CallContext ctx, String uri) {
        Resource resource = registry.resolveResource(uri);
        log.debug("Opening watch on {}", uri);
        return resource.watch(ctx);
    }

    @Override
    public List<CatalogEntry> catalog() {
        List<CatalogEntry> entries = new ArrayList<>();
        for (Command command : registry.listCommands()) {
            entries.add(new CatalogEntry(command.name(), CatalogEntry.Type.COMMAND, command.domain(),
                command.description(), command.supportsStreaming()));
        }
        for (Query query : registry.listQueries()) {
            entries.add(new CatalogEntry(query.name(), CatalogEntry.Type.QUERY, query.domain(),
                query.description(), false));
        }
        for (Resource resource : registry.listResources()) {
            entries.add(new CatalogEntry(resource.uri(), CatalogEntry.Type.RESOURCE, resource.domain(), "", false));
        }
        for (ResourceFactory factory : registry.listFactories()) {
            entries.add(new CatalogEntry(factory.pattern(), CatalogEntry.Type.RESOURCE_PATTERN, null, "", false));
        }
        entries.sort(Comparator.comparing(CatalogEntry::name));
        return List.copyOf(entries);
    }

    @Override
    public ErrorResponse toErrorResponse(Throwable error) {
        return ErrorResponse.from(error);
    }

    private Unit lookup(String unitName) {
        if (unitName == null || unitName.isBlank()) {
            throw UnitException.of(ErrorCode.UNIT_NOT_FOUND, "unit not found: " + unitName);
        }
        Command command = registry.getCommand(unitName).orElse(null);
        if (command != null) {
            return command;
        }
        return registry.getQuery(unitName).orElseThrow(
            () -> UnitException.of(ErrorCode.UNIT_NOT_FOUND, "unit not found: " + unitName));
    }

    private static Object normalize(Object input) {
        return input == null ? Map.of() : input;
    }

    private static void validateOutput(Unit unit, Map<String, Object> output) {
        try {
            unit.outputSchema().validate(output);
        } catch (UnitException e) {
            log.warn("Output of {} does not match its schema: {}", unit.name(), e.getMessage());
            throw new UnitException(ErrorCode.VALIDATION_FAILED, unit.domain(),
                "output validation failed for " + unit.name() + ": " + e.getMessage(), Map.of(), e);
        }
    }
}
