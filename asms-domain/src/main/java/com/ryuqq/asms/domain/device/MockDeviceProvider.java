package com.ryuqq.asms.domain.device;

import com.ryuqq.asms.core.context.CallContext;
import com.ryuqq.asms.core.error.ErrorCode;
import com.ryuqq.asms.core.error.UnitException;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 메모리 기반 DeviceProvider.
 *
 * <p>기본 상태로 장치 하나({@code gpu-0})를 가지며 모든 값은 실행 중에 바꿀 수 있습니다.
 * {@link #failWith(RuntimeException)}로 설정한 예외는 모든 호출에서 던져집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class MockDeviceProvider implements DeviceProvider {

    public static final String DEFAULT_DEVICE_ID = "gpu-0";

    private final List<DeviceInfo> devices = new CopyOnWriteArrayList<>();
    private final Map<String, DeviceMetrics> metrics = new ConcurrentHashMap<>();
    private final Map<String, DeviceHealth> health = new ConcurrentHashMap<>();
    private final Map<String, Double> powerLimits = new ConcurrentHashMap<>();
    private volatile RuntimeException failure;

    public MockDeviceProvider() {
        addDevice(
            new DeviceInfo(DEFAULT_DEVICE_ID, "Mock GPU", "MockVendor", "gpu", "mock-arch", 24564,
                List.of("cuda", "tensor")),
            new DeviceMetrics(50.0, 60.0, 200.0, 8_192_000_000L, 24_564_000_000L),
            DeviceHealth.healthy()
        );
    }

    /**
     * 장치 없이 시작하는 provider.
     */
    public static MockDeviceProvider empty() {
        MockDeviceProvider provider = new MockDeviceProvider();
        provider.clear();
        return provider;
    }

    public MockDeviceProvider addDevice(DeviceInfo device, DeviceMetrics deviceMetrics, DeviceHealth deviceHealth) {
        devices.removeIf(existing -> existing.id().equals(device.id()));
        devices.add(device);
        metrics.put(device.id(), deviceMetrics);
        health.put(device.id(), deviceHealth);
        return this;
    }

    public void setMetrics(String deviceId, DeviceMetrics deviceMetrics) {
        metrics.put(deviceId, deviceMetrics);
    }

    public void setHealth(String deviceId, DeviceHealth deviceHealth) {
        health.put(deviceId, deviceHealth);
    }

    public void failWith(RuntimeException error) {
        this.failure = error;
    }

    public void clearFailure() {
        this.failure = null;
    }

    public void clear() {
        devices.clear();
        metrics.clear();
        health.clear();
        powerLimits.clear();
    }

    public Optional<Double> powerLimit(String deviceId) {
        return Optional.ofNullable(powerLimits.get(deviceId));
    }

    @Override
    public List<DeviceInfo> detect(CallContext ctx) {
        check(ctx);
        return List.copyOf(devices);
    }

    @Override
    public DeviceInfo getDevice(CallContext ctx, String deviceId) {
        check(ctx);
        for (DeviceInfo device : devices) {
            if (device.id().equals(deviceId)) {
                return device;
            }
        }
        throw notFound(deviceId);
    }

    @Override
    public DeviceMetrics getMetrics(CallContext ctx, String deviceId) {
        check(ctx);
        DeviceMetrics value = metrics.get(deviceId);
        if (value == null) {
            throw notFound(deviceId);
        }
        return value;
    }

    @Override
    public DeviceHealth getHealth(CallContext ctx, String deviceId) {
        check(ctx);
        DeviceHealth value = health.get(deviceId);
        if (value == null) {
            throw notFound(deviceId);
        }
        return value;
    }

    @Override
    public void setPowerLimit(CallContext ctx, String deviceId, double limitWatts) {
        getDevice(ctx, deviceId);
        powerLimits.put(deviceId, limitWatts);
    }

    private void check(CallContext ctx) {
        ctx.throwIfDone();
        RuntimeException error = failure;
        if (error != null) {
            throw error;
        }
    }

    private static UnitException notFound(String deviceId) {
        return UnitException.of(DeviceEvents.DOMAIN, ErrorCode.DEVICE_NOT_FOUND, "device not found: " + deviceId);
    }
}
