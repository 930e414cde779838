package com.ryuqq.asms.domain.service;

import com.ryuqq.asms.core.context.CallContext;
import com.ryuqq.asms.core.context.ContextCancelledException;
import com.ryuqq.asms.core.contract.Command;
import com.ryuqq.asms.core.contract.Example;
import com.ryuqq.asms.core.contract.UnitDescriptor;
import com.ryuqq.asms.core.contract.Units;
import com.ryuqq.asms.core.error.ErrorCode;
import com.ryuqq.asms.core.error.UnitException;
import com.ryuqq.asms.core.event.EventPublisher;
import com.ryuqq.asms.core.schema.Inputs;
import com.ryuqq.asms.core.schema.Schema;
import com.ryuqq.asms.domain.support.DomainEvents;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * 서비스 도메인 Command 모음.
 *
 * <p><strong>제공 Command:</strong></p>
 * <ul>
 *   <li>{@code service.create} - provider에 배치 생성 후 pending 상태로 저장</li>
 *   <li>{@code service.delete} - 저장소에서 삭제</li>
 *   <li>{@code service.scale} - replica 수 변경</li>
 *   <li>{@code service.start} - starting을 거쳐 running (실패 시 failed)</li>
 *   <li>{@code service.stop} - stopping을 거쳐 stopped</li>
 * </ul>
 *
 * <p>상태가 바뀔 때마다 {@code service.*} 도메인 이벤트를 발행합니다.
 * start 실패 시 정리용 상태 기록은 호출 컨텍스트가 취소되었더라도 수행됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ServiceCommands {

    private static final Logger log = LoggerFactory.getLogger(ServiceCommands.class);

    static final int MAX_REPLICAS = 100;
    static final int MAX_START_TIMEOUT_SECONDS = 3600;

    static final UnitDescriptor CREATE = UnitDescriptor.of(
        "service.create",
        "Create a new model inference service",
        Schema.object()
            .property("model_id", Schema.string().minLength(1).description("Model to serve"))
            .property("resource_class", Schema.string().enumValues(ResourceClass.tokens())
                .defaultValue(ResourceClass.MEDIUM.getValue()).description("Resource class"))
            .property("replicas", Schema.number().min(1).max(MAX_REPLICAS).defaultValue(1)
                .description("Number of replicas"))
            .property("persistent", Schema.bool().description("Keep the service across restarts"))
            .required("model_id")
            .build(),
        Schema.object().property("service_id", Schema.string()).required("service_id").build(),
        List.of(Example.of(
            Map.of("model_id", "llama3-70b", "resource_class", "large", "replicas", 2),
            Map.of("service_id", "svc-vllm-llama3-70b"),
            "Create a large service with two replicas"
        ))
    );

    static final UnitDescriptor DELETE = UnitDescriptor.of(
        "service.delete",
        "Delete a model inference service",
        serviceIdSchema().build(),
        successSchema(),
        List.of(Example.of(Map.of("service_id", "svc-vllm-llama3-70b"), Map.of("success", true),
            "Delete a service"))
    );

    static final UnitDescriptor SCALE = UnitDescriptor.of(
        "service.scale",
        "Scale service replicas up or down",
        Schema.object()
            .property("service_id", Schema.string().description("Service ID"))
            .property("replicas", Schema.number().min(0).max(MAX_REPLICAS).description("Target replica count"))
            .required("service_id", "replicas")
            .build(),
        successSchema(),
        List.of(Example.of(Map.of("service_id", "svc-vllm-llama3-70b", "replicas", 4), Map.of("success", true),
            "Scale to four replicas"))
    );

    static final UnitDescriptor START = UnitDescriptor.of(
        "service.start",
        "Start a stopped service",
        serviceIdSchema()
            .property("timeout", Schema.number().min(1).max(MAX_START_TIMEOUT_SECONDS)
                .description("Start timeout in seconds"))
            .build(),
        successSchema(),
        List.of(Example.of(Map.of("service_id", "svc-vllm-llama3-70b", "timeout", 600), Map.of("success", true),
            "Start a service with a ten minute timeout"))
    );

    static final UnitDescriptor STOP = UnitDescriptor.of(
        "service.stop",
        "Stop a running service",
        serviceIdSchema()
            .property("force", Schema.bool().description("Force stop without draining requests"))
            .build(),
        successSchema(),
        List.of(Example.of(Map.of("service_id", "svc-vllm-llama3-70b"), Map.of("success", true),
            "Stop a service"))
    );

    private final ServiceStore store;
    private final ServiceProvider provider;
    private final EventPublisher publisher;
    private final Clock clock;

    /**
     * 생성자.
     *
     * @param store 서비스 저장소
     * @param provider 서비스 provider (nullable, 없으면 실행 시 provider_not_set)
     * @param publisher 이벤트 publisher (nullable)
     * @param clock 시각 기준
     */
    public ServiceCommands(ServiceStore store, ServiceProvider provider, EventPublisher publisher, Clock clock) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.store = store;
        this.provider = provider;
        this.publisher = EventPublisher.orNoop(publisher);
        this.clock = clock;
    }

    public Command create() {
        return Units.command(CREATE, this::handleCreate, publisher, clock);
    }

    public Command delete() {
        return Units.command(DELETE, this::handleDelete, publisher, clock);
    }

    public Command scale() {
        return Units.command(SCALE, this::handleScale, publisher, clock);
    }

    public Command start() {
        return Units.command(START, this::handleStart, publisher, clock);
    }

    public Command stop() {
        return Units.command(STOP, this::handleStop, publisher, clock);
    }

    public List<Command> all() {
        return List.of(create(), delete(), scale(), start(), stop());
    }

    private Map<String, Object> handleCreate(CallContext ctx, Map<String, Object> input) {
        ServiceProvider p = requireProvider(provider);
        String modelId = Inputs.requireString(input, "model_id");
        ResourceClass resourceClass = Inputs.nonEmptyString(input, "resource_class")
            .map(ServiceCommands::parseResourceClass)
            .orElse(ResourceClass.MEDIUM);
        int replicas = Inputs.integer(input, "replicas").orElse(1);
        if (replicas < 1 || replicas > MAX_REPLICAS) {
            throw invalid("replicas must be between 1 and " + MAX_REPLICAS + " (current: " + replicas + ")");
        }
        boolean persistent = Inputs.bool(input, "persistent").orElse(false);

        ModelService created;
        try {
            ModelService deployed = p.create(ctx, modelId, resourceClass, replicas, persistent);
            created = store.create(ctx, deployed.withStatus(ServiceStatus.PENDING).withActiveReplicas(0));
        } catch (UnitException e) {
            throw UnitException.wrap("create service", e);
        }
        log.info("Created service {} for model {} ({}, replicas={})", created.id(), modelId, resourceClass, replicas);
        DomainEvents.publish(publisher, ServiceEvents.created(created, clock));
        return Map.of("service_id", created.id());
    }

    private Map<String, Object> handleDelete(CallContext ctx, Map<String, Object> input) {
        String serviceId = Inputs.requireString(input, "service_id");
        try {
            store.delete(ctx, serviceId);
        } catch (UnitException e) {
            throw UnitException.wrap("delete service " + serviceId, e);
        }
        log.info("Deleted service {}", serviceId);
        return success();
    }

    private Map<String, Object> handleScale(CallContext ctx, Map<String, Object> input) {
        ServiceProvider p = requireProvider(provider);
        String serviceId = Inputs.requireString(input, "service_id");
        OptionalInt requested = Inputs.integer(input, "replicas");
        if (requested.isEmpty()) {
            throw invalid("replicas is required");
        }
        int replicas = requested.getAsInt();
        if (replicas < 0) {
            throw invalid("replicas must be a non-negative integer");
        }
        if (replicas > MAX_REPLICAS) {
            throw invalid("replicas must not exceed " + MAX_REPLICAS + " (current: " + replicas + ")");
        }

        ModelService service = get(ctx, serviceId);
        try {
            p.scale(ctx, serviceId, replicas);
        } catch (ContextCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new UnitException(ErrorCode.SERVICE_SCALE_FAILED, ServiceEvents.DOMAIN,
                "scale service " + serviceId + ": " + e.getMessage(), null, e);
        }

        int active = service.status() == ServiceStatus.RUNNING ? replicas : service.activeReplicas();
        ModelService scaled = update(ctx, service.withReplicas(replicas).withActiveReplicas(active));
        log.info("Scaled service {} from {} to {} replica(s)", serviceId, service.replicas(), replicas);
        DomainEvents.publish(publisher, ServiceEvents.scaled(scaled, service.replicas(), clock));
        return success();
    }

    private Map<String, Object> handleStart(CallContext ctx, Map<String, Object> input) {
        ServiceProvider p = requireProvider(provider);
        String serviceId = Inputs.requireString(input, "service_id");
        OptionalInt timeout = Inputs.integer(input, "timeout");
        if (timeout.isPresent() && (timeout.getAsInt() < 1 || timeout.getAsInt() > MAX_START_TIMEOUT_SECONDS)) {
            throw invalid("timeout must be between 1 and " + MAX_START_TIMEOUT_SECONDS + " seconds (current: "
                + timeout.getAsInt() + ")");
        }

        ModelService service = get(ctx, serviceId);
        switch (service.status()) {
            case RUNNING -> {
                if (p.isRunning(ctx, serviceId)) {
                    throw UnitException.of(ServiceEvents.DOMAIN, ErrorCode.ALREADY_EXISTS,
                        "service already running: " + serviceId);
                }
                log.warn("Service {} is marked running but the provider reports it stopped, resetting", serviceId);
                service = update(ctx, service.withStatus(ServiceStatus.STOPPED).withActiveReplicas(0));
            }
            case STARTING -> throw UnitException.of(ServiceEvents.DOMAIN, ErrorCode.ALREADY_EXISTS,
                "service already starting: " + serviceId);
            case STOPPING -> throw UnitException.of(ServiceEvents.DOMAIN, ErrorCode.SERVICE_START_FAILED,
                "service is stopping: " + serviceId);
            case PENDING, STOPPED, FAILED -> log.debug("Starting service {} from {}", serviceId, service.status());
        }

        ModelService starting = update(ctx, service.withStatus(ServiceStatus.STARTING));
        CallContext startCtx = timeout.isPresent() ? ctx.withTimeout(Duration.ofSeconds(timeout.getAsInt())) : ctx;
        try {
            p.start(startCtx, serviceId);
        } catch (RuntimeException e) {
            ModelService failed = store.update(CallContext.background(),
                starting.withStatus(ServiceStatus.FAILED).withActiveReplicas(0));
            log.warn("Service {} failed to start: {}", serviceId, e.getMessage());
            DomainEvents.publish(publisher, ServiceEvents.failed(failed, e, clock));
            if (e instanceof ContextCancelledException) {
                throw e;
            }
            throw new UnitException(ErrorCode.SERVICE_START_FAILED, ServiceEvents.DOMAIN,
                "start service " + serviceId + ": " + e.getMessage(), null, e);
        } finally {
            if (startCtx != ctx) {
                startCtx.cancel();
            }
        }

        ModelService running = update(ctx,
            starting.withStatus(ServiceStatus.RUNNING).withActiveReplicas(starting.replicas()));
        log.info("Service {} is running with {} replica(s)", serviceId, running.replicas());
        DomainEvents.publish(publisher, ServiceEvents.started(running, clock));
        return success();
    }

    private Map<String, Object> handleStop(CallContext ctx, Map<String, Object> input) {
        ServiceProvider p = requireProvider(provider);
        String serviceId = Inputs.requireString(input, "service_id");
        boolean force = Inputs.bool(input, "force").orElse(false);

        ModelService service = get(ctx, serviceId);
        if (service.status() == ServiceStatus.STOPPED) {
            log.debug("Service {} is already stopped", serviceId);
            return success();
        }

        ServiceStatus previous = service.status();
        ModelService stopping = update(ctx, service.withStatus(ServiceStatus.STOPPING));
        try {
            p.stop(ctx, serviceId, force);
        } catch (RuntimeException e) {
            if (previous == ServiceStatus.RUNNING || e instanceof ContextCancelledException) {
                store.update(CallContext.background(), stopping.withStatus(previous));
                throw e instanceof ContextCancelledException ? e : UnitException.wrap("stop service " + serviceId, e);
            }
            log.warn("Ignoring stop error for non-running service {} ({}): {}", serviceId, previous, e.getMessage());
        }

        ModelService stopped = update(ctx, stopping.withStatus(ServiceStatus.STOPPED).withActiveReplicas(0));
        log.info("Service {} stopped{}", serviceId, force ? " (forced)" : "");
        DomainEvents.publish(publisher, ServiceEvents.stopped(stopped, force ? "forced" : "requested", clock));
        return success();
    }

    private ModelService get(CallContext ctx, String serviceId) {
        try {
            return store.get(ctx, serviceId);
        } catch (UnitException e) {
            throw UnitException.wrap("get service " + serviceId, e);
        }
    }

    private ModelService update(CallContext ctx, ModelService service) {
        try {
            return store.update(ctx, service);
        } catch (UnitException e) {
            throw UnitException.wrap("update service " + service.id(), e);
        }
    }

    static ServiceProvider requireProvider(ServiceProvider provider) {
        if (provider == null) {
            throw UnitException.of(ServiceEvents.DOMAIN, ErrorCode.PROVIDER_NOT_SET, "service provider not set");
        }
        return provider;
    }

    static ResourceClass parseResourceClass(String value) {
        return ResourceClass.fromValue(value).orElseThrow(() -> invalid("invalid resource class: " + value));
    }

    static UnitException invalid(String message) {
        return UnitException.of(ServiceEvents.DOMAIN, ErrorCode.INVALID_INPUT, message);
    }

    private static Schema.Builder serviceIdSchema() {
        return Schema.object()
            .property("service_id", Schema.string().description("Service ID"))
            .required("service_id");
    }

    private static Schema successSchema() {
        return Schema.object().property("success", Schema.bool()).required("success").build();
    }

    private static Map<String, Object> success() {
        return Map.of("success", true);
    }
}
