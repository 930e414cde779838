package com.ryuqq.asms.domain.device;

import com.ryuqq.asms.core.context.CallContext;
import com.ryuqq.asms.core.error.ErrorCode;
import com.ryuqq.asms.core.error.UnitException;
import com.ryuqq.asms.runtime.event.InMemoryEventBus;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * DeviceCommands 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class DeviceCommandsTest {

    private final Clock clock = Clock.systemUTC();
    private final MockDeviceProvider provider = new MockDeviceProvider();
    private final InMemoryEventBus bus = new InMemoryEventBus();
    private final DeviceCommands commands = new DeviceCommands(provider, bus, clock);
    private final CallContext ctx = CallContext.background();

    @Test
    @SuppressWarnings("unchecked")
    void detect_장치_목록과_detected_이벤트() {
        // when
        Map<String, Object> output = commands.detect().execute(ctx, Map.of());

        // then
        List<Map<String, Object>> devices = (List<Map<String, Object>>) output.get("devices");
        assertThat(devices).hasSize(1);
        assertThat(devices.get(0))
            .containsEntry("id", "gpu-0")
            .containsEntry("type", "gpu")
            .containsEntry("memory", 24564L);
        assertThat(bus.eventsOfType(DeviceEvents.DETECTED)).hasSize(1);
    }

    @Test
    void provider가_없으면_provider_not_set() {
        DeviceCommands withoutProvider = new DeviceCommands(null, bus, clock);

        assertThatThrownBy(() -> withoutProvider.detect().execute(ctx, Map.of()))
            .satisfies(e -> assertThat(UnitException.hasCode(e, ErrorCode.PROVIDER_NOT_SET)).isTrue());
    }

    @Test
    void detect_provider_오류는_문맥과_함께_전파() {
        provider.failWith(UnitException.of("device", ErrorCode.DEVICE_UNREACHABLE, "driver not loaded"));

        assertThatThrownBy(() -> commands.detect().execute(ctx, Map.of()))
            .hasMessage("detect devices: driver not loaded")
            .satisfies(e -> assertThat(UnitException.hasCode(e, ErrorCode.DEVICE_UNREACHABLE)).isTrue());
    }

    @Test
    void set_power_limit_정수와_실수_모두_허용() {
        commands.setPowerLimit().execute(ctx, Map.of("device_id", "gpu-0", "limit_watts", 250));
        assertThat(provider.powerLimit("gpu-0")).contains(250.0);

        commands.setPowerLimit().execute(ctx, Map.of("device_id", "gpu-0", "limit_watts", 180.5f));
        assertThat(provider.powerLimit("gpu-0")).contains(180.5);
    }

    @Test
    void set_power_limit_잘못된_입력() {
        assertThatThrownBy(() -> commands.setPowerLimit().execute(ctx, Map.of("device_id", "", "limit_watts", 100)))
            .satisfies(e -> assertThat(UnitException.hasCode(e, ErrorCode.INVALID_DEVICE_ID)).isTrue());
        assertThatThrownBy(() -> commands.setPowerLimit().execute(ctx, Map.of("device_id", "gpu-0", "limit_watts", 0)))
            .satisfies(e -> assertThat(UnitException.hasCode(e, ErrorCode.INVALID_POWER_LIMIT)).isTrue());
        assertThatThrownBy(() -> commands.setPowerLimit().execute(ctx,
            Map.of("device_id", "gpu-0", "limit_watts", "lots")))
            .satisfies(e -> assertThat(UnitException.hasCode(e, ErrorCode.INVALID_POWER_LIMIT)).isTrue());
        assertThat(provider.powerLimit("gpu-0")).isEmpty();
    }

    @Test
    void set_power_limit_NaN과_무한대는_invalid_power_limit() {
        for (double limit : new double[]{Double.NaN, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY}) {
            assertThatThrownBy(() -> commands.setPowerLimit().execute(ctx,
                Map.of("device_id", "gpu-0", "limit_watts", limit)))
                .satisfies(e -> assertThat(UnitException.hasCode(e, ErrorCode.INVALID_POWER_LIMIT)).isTrue());
        }
        assertThat(provider.powerLimit("gpu-0")).isEmpty();
    }

    @Test
    void set_power_limit_없는_장치는_device_not_found() {
        assertThatThrownBy(() -> commands.setPowerLimit().execute(ctx,
            Map.of("device_id", "gpu-9", "limit_watts", 100)))
            .hasMessageStartingWith("set power limit for device gpu-9")
            .satisfies(e -> assertThat(UnitException.isNotFound(e)).isTrue());
    }
}
