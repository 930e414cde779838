package com.ryuqq.asms.domain.device;

import com.ryuqq.asms.core.context.CallContext;
import com.ryuqq.asms.core.contract.Command;
import com.ryuqq.asms.core.contract.Example;
import com.ryuqq.asms.core.contract.UnitDescriptor;
import com.ryuqq.asms.core.contract.Units;
import com.ryuqq.asms.core.error.ErrorCode;
import com.ryuqq.asms.core.error.UnitException;
import com.ryuqq.asms.core.event.EventPublisher;
import com.ryuqq.asms.core.schema.Inputs;
import com.ryuqq.asms.core.schema.Numbers;
import com.ryuqq.asms.core.schema.Schema;
import com.ryuqq.asms.domain.support.DomainEvents;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 장치 도메인 Command 모음.
 *
 * <p><strong>제공 Command:</strong></p>
 * <ul>
 *   <li>{@code device.detect} - 장치 탐지, 장치마다 {@code device.detected} 발행</li>
 *   <li>{@code device.set_power_limit} - 전력 제한 설정</li>
 * </ul>
 *
 * <p>provider가 없으면 모든 Command가 {@code provider_not_set}으로 실패합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DeviceCommands {

    private static final Logger log = LoggerFactory.getLogger(DeviceCommands.class);

    static final UnitDescriptor DETECT = UnitDescriptor.of(
        "device.detect",
        "Detect hardware devices on the system",
        Schema.object().build(),
        Schema.object()
            .property("devices", Schema.arrayOf(Schema.object()
                .property("id", Schema.string())
                .property("name", Schema.string())
                .property("vendor", Schema.string())
                .property("type", Schema.string())
                .property("memory", Schema.number())
                .property("architecture", Schema.string())))
            .required("devices")
            .build(),
        List.of(Example.of(
            Map.of(),
            Map.of("devices", List.of(Map.of("id", "gpu-0", "name", "NVIDIA RTX 4090", "vendor", "NVIDIA",
                "type", "gpu", "memory", 24564))),
            "Detect all hardware devices"
        ))
    );

    static final UnitDescriptor SET_POWER_LIMIT = UnitDescriptor.of(
        "device.set_power_limit",
        "Set power consumption limit for a device",
        Schema.object()
            .property("device_id", Schema.string().description("Device identifier"))
            .property("limit_watts", Schema.number().min(0).description("Power limit in watts"))
            .required("device_id", "limit_watts")
            .build(),
        Schema.object().property("success", Schema.bool()).build(),
        List.of(Example.of(Map.of("device_id", "gpu-0", "limit_watts", 250.0), Map.of("success", true),
            "Set power limit to 250 watts for gpu-0"))
    );

    private final DeviceProvider provider;
    private final EventPublisher publisher;
    private final Clock clock;

    /**
     * 생성자.
     *
     * @param provider 장치 provider (nullable, 없으면 실행 시 provider_not_set)
     * @param publisher 이벤트 publisher (nullable)
     * @param clock 시각 기준
     */
    public DeviceCommands(DeviceProvider provider, EventPublisher publisher, Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.provider = provider;
        this.publisher = EventPublisher.orNoop(publisher);
        this.clock = clock;
    }

    public Command detect() {
        return Units.command(DETECT, this::handleDetect, publisher, clock);
    }

    public Command setPowerLimit() {
        return Units.command(SET_POWER_LIMIT, this::handleSetPowerLimit, publisher, clock);
    }

    public List<Command> all() {
        return List.of(detect(), setPowerLimit());
    }

    private Map<String, Object> handleDetect(CallContext ctx, Map<String, Object> input) {
        DeviceProvider p = requireProvider(provider);
        List<DeviceInfo> devices;
        try {
            devices = p.detect(ctx);
        } catch (UnitException e) {
            throw UnitException.wrap("detect devices", e);
        }

        List<Map<String, Object>> result = new ArrayList<>(devices.size());
        for (DeviceInfo device : devices) {
            result.add(DeviceViews.summary(device));
            DomainEvents.publish(publisher, DeviceEvents.detected(device, clock));
        }
        log.debug("Detected {} device(s)", devices.size());
        return Map.of("devices", result);
    }

    private Map<String, Object> handleSetPowerLimit(CallContext ctx, Map<String, Object> input) {
        DeviceProvider p = requireProvider(provider);
        String deviceId = Inputs.string(input, "device_id");
        if (deviceId.isEmpty()) {
            throw UnitException.of(DeviceEvents.DOMAIN, ErrorCode.INVALID_DEVICE_ID, "invalid device id");
        }
        Object raw = input.get("limit_watts");
        if (!Numbers.isFinite(raw) || ((Number) raw).doubleValue() <= 0) {
            throw UnitException.of(DeviceEvents.DOMAIN, ErrorCode.INVALID_POWER_LIMIT,
                "invalid power limit: must be a positive number");
        }
        double limit = ((Number) raw).doubleValue();

        try {
            p.setPowerLimit(ctx, deviceId, limit);
        } catch (UnitException e) {
            throw UnitException.wrap("set power limit for device " + deviceId, e);
        }
        log.info("Power limit for {} set to {}W", deviceId, limit);
        return Map.of("success", true);
    }

    static DeviceProvider requireProvider(DeviceProvider provider) {
        if (provider == null) {
            throw UnitException.of(DeviceEvents.DOMAIN, ErrorCode.PROVIDER_NOT_SET, "device provider not set");
        }
        return provider;
    }
}
