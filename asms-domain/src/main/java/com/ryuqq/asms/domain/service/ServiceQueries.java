package com.ryuqq.asms.domain.service;

import com.ryuqq.asms.core.context.CallContext;
import com.ryuqq.asms.core.contract.Example;
import com.ryuqq.asms.core.contract.Query;
import com.ryuqq.asms.core.contract.UnitDescriptor;
import com.ryuqq.asms.core.contract.Units;
import com.ryuqq.asms.core.error.UnitException;
import com.ryuqq.asms.core.event.EventPublisher;
import com.ryuqq.asms.core.schema.Inputs;
import com.ryuqq.asms.core.schema.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * 서비스 도메인 Query 모음.
 *
 * <p><strong>제공 Query:</strong></p>
 * <ul>
 *   <li>{@code service.get} - 상세 정보, running이면 provider 지표 포함</li>
 *   <li>{@code service.list} - status/model_id 필터 + 페이지 조회, total 포함</li>
 *   <li>{@code service.status} - 상태 요약</li>
 *   <li>{@code service.recommend} - 모델별 권장 구성</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ServiceQueries {

    private static final Logger log = LoggerFactory.getLogger(ServiceQueries.class);

    static final int DEFAULT_LIST_LIMIT = 100;
    static final int MAX_LIST_LIMIT = 100;

    static final Schema SERVICE_SCHEMA = Schema.object()
        .property("id", Schema.string())
        .property("name", Schema.string())
        .property("model_id", Schema.string())
        .property("status", Schema.string().enumValues(ServiceStatus.tokens()))
        .property("replicas", Schema.number())
        .property("active_replicas", Schema.number())
        .property("resource_class", Schema.string())
        .property("endpoints", Schema.arrayOf(Schema.string()))
        .property("metrics", Schema.object()
            .property("requests_per_second", Schema.number())
            .property("latency_p50", Schema.number())
            .property("latency_p99", Schema.number())
            .property("total_requests", Schema.number())
            .property("error_rate", Schema.number()))
        .required("id", "model_id", "status")
        .build();

    static final Schema SERVICES_SCHEMA = Schema.object()
        .property("services", Schema.arrayOf(Schema.object()
            .property("id", Schema.string())
            .property("model_id", Schema.string())
            .property("status", Schema.string())
            .property("replicas", Schema.number())
            .property("endpoints", Schema.arrayOf(Schema.string()))))
        .property("total", Schema.number())
        .required("services", "total")
        .build();

    static final UnitDescriptor GET = UnitDescriptor.of(
        "service.get",
        "Get detailed information about a service",
        serviceIdSchema(),
        SERVICE_SCHEMA,
        List.of(Example.of(
            Map.of("service_id", "svc-vllm-llama3-70b"),
            Map.of("id", "svc-vllm-llama3-70b", "model_id", "llama3-70b", "status", "running", "replicas", 2,
                "endpoints", List.of("http://localhost:8080")),
            "Get service details"
        ))
    );

    static final UnitDescriptor LIST = UnitDescriptor.of(
        "service.list",
        "List all services with optional filtering",
        Schema.object()
            .property("status", Schema.string().enumValues(ServiceStatus.tokens()).description("Filter by status"))
            .property("model_id", Schema.string().description("Filter by model ID"))
            .property("limit", Schema.number().min(1).max(MAX_LIST_LIMIT).defaultValue(DEFAULT_LIST_LIMIT))
            .property("offset", Schema.number().min(0).defaultValue(0))
            .build(),
        SERVICES_SCHEMA,
        List.of(
            Example.of(Map.of(), Map.of("services", List.of(), "total", 0), "List all services"),
            Example.of(Map.of("status", "running"), Map.of("services", List.of(), "total", 0),
                "List running services")
        )
    );

    static final UnitDescriptor STATUS = UnitDescriptor.of(
        "service.status",
        "Get the current status of a service",
        serviceIdSchema(),
        Schema.object()
            .property("id", Schema.string())
            .property("name", Schema.string())
            .property("model_id", Schema.string())
            .property("status", Schema.string().enumValues(ServiceStatus.tokens()))
            .property("replicas", Schema.number())
            .property("active_replicas", Schema.number())
            .property("endpoints", Schema.arrayOf(Schema.string()))
            .required("id", "status")
            .build(),
        List.of(Example.of(
            Map.of("service_id", "svc-vllm-llama3-70b"),
            Map.of("id", "svc-vllm-llama3-70b", "status", "running"),
            "Get service status"
        ))
    );

    static final UnitDescriptor RECOMMEND = UnitDescriptor.of(
        "service.recommend",
        "Get recommended configuration for a model",
        Schema.object()
            .property("model_id", Schema.string().minLength(1).description("Model ID to get recommendation for"))
            .property("hint", Schema.string()
                .description("Optional hint for recommendation (e.g., 'high-throughput', 'cost-effective')"))
            .required("model_id")
            .build(),
        Schema.object()
            .property("resource_class", Schema.string().enumValues(ResourceClass.tokens()))
            .property("replicas", Schema.number())
            .property("expected_throughput", Schema.number())
            .property("engine_type", Schema.string())
            .property("device_type", Schema.string())
            .property("reason", Schema.string())
            .required("resource_class", "replicas")
            .build(),
        List.of(Example.of(
            Map.of("model_id", "sensevoice-small"),
            Map.of("resource_class", "small", "replicas", 1, "expected_throughput", 10.0, "engine_type", "whisper",
                "device_type", "cpu", "reason", "ASR model runs efficiently on CPU"),
            "Get recommendation for an ASR model"
        ))
    );

    private final ServiceStore store;
    private final ServiceProvider provider;
    private final EventPublisher publisher;
    private final Clock clock;

    public ServiceQueries(ServiceStore store, ServiceProvider provider, EventPublisher publisher, Clock clock) {
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

    public Query get() {
        return Units.query(GET, this::handleGet, publisher, clock);
    }

    public Query list() {
        return Units.query(LIST, this::handleList, publisher, clock);
    }

    public Query status() {
        return Units.query(STATUS, this::handleStatus, publisher, clock);
    }

    public Query recommend() {
        return Units.query(RECOMMEND, this::handleRecommend, publisher, clock);
    }

    public List<Query> all() {
        return List.of(get(), list(), status(), recommend());
    }

    private Map<String, Object> handleGet(CallContext ctx, Map<String, Object> input) {
        String serviceId = Inputs.requireString(input, "service_id");
        ModelService service = find(ctx, serviceId);
        Map<String, Object> view = ServiceViews.service(service);
        if (provider != null && service.status() == ServiceStatus.RUNNING) {
            try {
                view.put("metrics", ServiceViews.metrics(provider.getMetrics(ctx, serviceId)));
            } catch (UnitException e) {
                log.debug("Metrics unavailable for service {}: {}", serviceId, e.getMessage());
            }
        }
        return view;
    }

    private Map<String, Object> handleList(CallContext ctx, Map<String, Object> input) {
        ServicePage page;
        try {
            page = store.list(ctx, parseFilter(input));
        } catch (UnitException e) {
            throw UnitException.wrap("list services", e);
        }
        return ServiceViews.page(page);
    }

    private Map<String, Object> handleStatus(CallContext ctx, Map<String, Object> input) {
        String serviceId = Inputs.requireString(input, "service_id");
        return ServiceViews.status(find(ctx, serviceId));
    }

    private Map<String, Object> handleRecommend(CallContext ctx, Map<String, Object> input) {
        ServiceProvider p = ServiceCommands.requireProvider(provider);
        String modelId = Inputs.requireString(input, "model_id");
        String hint = Inputs.string(input, "hint");
        try {
            return ServiceViews.recommendation(p.getRecommendation(ctx, modelId, hint));
        } catch (UnitException e) {
            throw UnitException.wrap("get recommendation", e);
        }
    }

    private ModelService find(CallContext ctx, String serviceId) {
        try {
            return store.get(ctx, serviceId);
        } catch (UnitException e) {
            throw UnitException.wrap("get service " + serviceId, e);
        }
    }

    static ServiceFilter parseFilter(Map<String, Object> input) {
        ServiceStatus status = Inputs.nonEmptyString(input, "status")
            .map(value -> ServiceStatus.fromValue(value).orElseThrow(() ->
                ServiceCommands.invalid("invalid status: " + value)))
            .orElse(null);
        String modelId = Inputs.string(input, "model_id");

        int limit = Inputs.integer(input, "limit").orElse(DEFAULT_LIST_LIMIT);
        if (limit < 1 || limit > MAX_LIST_LIMIT) {
            throw ServiceCommands.invalid("limit must be between 1 and " + MAX_LIST_LIMIT + " (current: " + limit + ")");
        }
        int offset = Inputs.integer(input, "offset").orElse(0);
        if (offset < 0) {
            throw ServiceCommands.invalid("offset must be non-negative (current: " + offset + ")");
        }
        return new ServiceFilter(status, modelId, limit, offset);
    }

    private static Schema serviceIdSchema() {
        return Schema.object()
            .property("service_id", Schema.string().description("Service ID"))
            .required("service_id")
            .build();
    }
}
