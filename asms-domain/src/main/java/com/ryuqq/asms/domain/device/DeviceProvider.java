package com.ryuqq.asms.domain.device;

import com.ryuqq.asms.core.context.CallContext;

import java.util.List;

/**
 * 장치 백엔드 추상화.
 *
 * <p>알 수 없는 장치는 {@code device_not_found}, 통신 실패는 {@code device_unreachable} /
 * {@code device_metrics_error} 코드의 {@link com.ryuqq.asms.core.error.UnitException}으로 실패합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface DeviceProvider {

    List<DeviceInfo> detect(CallContext ctx);

    DeviceInfo getDevice(CallContext ctx, String deviceId);

    DeviceMetrics getMetrics(CallContext ctx, String deviceId);

    DeviceHealth getHealth(CallContext ctx, String deviceId);

    void setPowerLimit(CallContext ctx, String deviceId, double limitWatts);
}
