package com.ryuqq.asms.domain.device;

import com.ryuqq.asms.core.context.CallContext;
import com.ryuqq.asms.core.context.ContextCancelledException;
import com.ryuqq.asms.core.contract.Example;
import com.ryuqq.asms.core.contract.Query;
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
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 장치 도메인 Query 모음.
 *
 * <p><strong>제공 Query:</strong></p>
 * <ul>
 *   <li>{@code device.info} - device_id가 없으면 전체 목록</li>
 *   <li>{@code device.metrics} - device_id가 없으면 첫 번째 장치, 기준 초과 시 metrics_alert 발행</li>
 *   <li>{@code device.health} - device_id가 없으면 장치별 결과, 개별 실패는 unknown으로 변환</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DeviceQueries {

    private static final Logger log = LoggerFactory.getLogger(DeviceQueries.class);

    static final Schema INFO_SCHEMA = Schema.object()
        .property("id", Schema.string())
        .property("name", Schema.string())
        .property("vendor", Schema.string())
        .property("type", Schema.string())
        .property("architecture", Schema.string())
        .property("capabilities", Schema.arrayOf(Schema.string()))
        .property("memory", Schema.number())
        .build();

    static final Schema METRICS_SCHEMA = Schema.object()
        .property("utilization", Schema.number())
        .property("temperature", Schema.number())
        .property("power", Schema.number())
        .property("memory_used", Schema.number())
        .property("memory_total", Schema.number())
        .build();

    static final Schema HEALTH_SCHEMA = Schema.object()
        .property("status", Schema.string().enumValues(DeviceViews.healthTokens()))
        .property("issues", Schema.arrayOf(Schema.string()))
        .build();

    static final UnitDescriptor INFO = UnitDescriptor.of(
        "device.info",
        "Get detailed information about a device or all devices",
        Schema.object()
            .property("device_id", Schema.string()
                .description("Device identifier (optional, returns all if not specified)"))
            .build(),
        INFO_SCHEMA,
        List.of(
            Example.of(Map.of("device_id", "gpu-0"),
                Map.of("id", "gpu-0", "name", "NVIDIA RTX 4090", "vendor", "NVIDIA", "architecture", "Ada Lovelace",
                    "capabilities", List.of("cuda", "tensor"), "memory", 24564),
                "Get info for a specific device"),
            Example.of(Map.of(), Map.of("devices", List.of(Map.of("id", "gpu-0", "name", "NVIDIA RTX 4090"))),
                "Get info for all devices when device_id is not provided")
        )
    );

    static final UnitDescriptor METRICS = UnitDescriptor.of(
        "device.metrics",
        "Get real-time metrics for a device",
        Schema.object()
            .property("device_id", Schema.string()
                .description("Device identifier (optional, returns first device metrics if not specified)"))
            .property("history", Schema.bool().description("Include historical data"))
            .build(),
        METRICS_SCHEMA,
        List.of(Example.of(Map.of("device_id", "gpu-0"),
            Map.of("utilization", 75.5, "temperature", 65.0, "power", 200.0, "memory_used", 16_384_000_000L,
                "memory_total", 24_564_000_000L),
            "Get real-time metrics for a specific device"))
    );

    static final UnitDescriptor HEALTH = UnitDescriptor.of(
        "device.health",
        "Check health status of a device",
        Schema.object()
            .property("device_id", Schema.string()
                .description("Device identifier (optional, checks all devices if not specified)"))
            .build(),
        HEALTH_SCHEMA,
        List.of(
            Example.of(Map.of("device_id", "gpu-0"), Map.of("status", "healthy", "issues", List.of()),
                "Health check for a healthy device"),
            Example.of(Map.of("device_id", "gpu-1"),
                Map.of("status", "warning", "issues", List.of("High temperature detected")),
                "Health check for a device with warnings")
        )
    );

    private final DeviceProvider provider;
    private final DeviceMetricsThresholds thresholds;
    private final EventPublisher publisher;
    private final Clock clock;

    public DeviceQueries(DeviceProvider provider, EventPublisher publisher, Clock clock) {
        this(provider, DeviceMetricsThresholds.NONE, publisher, clock);
    }

    /**
     * 생성자.
     *
     * @param provider 장치 provider (nullable)
     * @param thresholds metrics 알림 기준
     * @param publisher 이벤트 publisher (nullable)
     * @param clock 시각 기준
     */
    public DeviceQueries(
        DeviceProvider provider,
        DeviceMetricsThresholds thresholds,
        EventPublisher publisher,
        Clock clock
    ) {
        if (thresholds == null) {
            throw new IllegalArgumentException("thresholds cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.provider = provider;
        this.thresholds = thresholds;
        this.publisher = EventPublisher.orNoop(publisher);
        this.clock = clock;
    }

    public Query info() {
        return Units.query(INFO, this::handleInfo, publisher, clock);
    }

    public Query metrics() {
        return Units.query(METRICS, this::handleMetrics, publisher, clock);
    }

    public Query health() {
        return Units.query(HEALTH, this::handleHealth, publisher, clock);
    }

    public List<Query> all() {
        return List.of(info(), metrics(), health());
    }

    private Map<String, Object> handleInfo(CallContext ctx, Map<String, Object> input) {
        DeviceProvider p = DeviceCommands.requireProvider(provider);
        Optional<String> deviceId = Inputs.nonEmptyString(input, "device_id");
        if (deviceId.isPresent()) {
            try {
                return DeviceViews.info(p.getDevice(ctx, deviceId.get()));
            } catch (UnitException e) {
                throw UnitException.wrap("get device " + deviceId.get(), e);
            }
        }

        List<Map<String, Object>> result = new ArrayList<>();
        for (DeviceInfo device : detect(ctx, p)) {
            result.add(DeviceViews.info(device));
        }
        return Map.of("devices", result);
    }

    private Map<String, Object> handleMetrics(CallContext ctx, Map<String, Object> input) {
        DeviceProvider p = DeviceCommands.requireProvider(provider);
        String deviceId = Inputs.string(input, "device_id");
        if (deviceId.isEmpty()) {
            List<DeviceInfo> devices = detect(ctx, p);
            if (devices.isEmpty()) {
                throw UnitException.of(DeviceEvents.DOMAIN, ErrorCode.DEVICE_NOT_FOUND, "no devices detected");
            }
            deviceId = devices.get(0).id();
        }

        DeviceMetrics metrics;
        try {
            metrics = p.getMetrics(ctx, deviceId);
        } catch (UnitException e) {
            throw UnitException.wrap("get metrics for device " + deviceId, e);
        }
        checkThresholds(deviceId, metrics);
        return DeviceViews.metrics(metrics);
    }

    private Map<String, Object> handleHealth(CallContext ctx, Map<String, Object> input) {
        DeviceProvider p = DeviceCommands.requireProvider(provider);
        Optional<String> deviceId = Inputs.nonEmptyString(input, "device_id");
        if (deviceId.isPresent()) {
            try {
                return DeviceViews.health(p.getHealth(ctx, deviceId.get()));
            } catch (UnitException e) {
                throw UnitException.wrap("get health for device " + deviceId.get(), e);
            }
        }

        List<Map<String, Object>> results = new ArrayList<>();
        for (DeviceInfo device : detect(ctx, p)) {
            DeviceHealth health;
            try {
                health = p.getHealth(ctx, device.id());
            } catch (ContextCancelledException e) {
                throw e;
            } catch (RuntimeException e) {
                log.warn("Health check failed for {}: {}", device.id(), e.getMessage());
                health = DeviceHealth.unknown(e.getMessage());
            }
            results.add(DeviceViews.health(device.id(), health));
        }
        return Map.of("devices", results);
    }

    private static List<DeviceInfo> detect(CallContext ctx, DeviceProvider p) {
        try {
            return p.detect(ctx);
        } catch (UnitException e) {
            throw UnitException.wrap("detect devices", e);
        }
    }

    private void checkThresholds(String deviceId, DeviceMetrics metrics) {
        if (thresholds.temperature() != null && metrics.temperature() > thresholds.temperature()) {
            DomainEvents.publish(publisher, DeviceEvents.metricsAlert(
                deviceId, "temperature", metrics.temperature(), thresholds.temperature(), clock));
        }
        if (thresholds.utilization() != null && metrics.utilization() > thresholds.utilization()) {
            DomainEvents.publish(publisher, DeviceEvents.metricsAlert(
                deviceId, "utilization", metrics.utilization(), thresholds.utilization(), clock));
        }
    }
}
