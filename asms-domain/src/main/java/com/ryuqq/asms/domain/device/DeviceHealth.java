package com.ryuqq.asms.domain.device;

import java.util.List;

/**
 * 장치 상태 점검 결과.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param status 상태
 * @param issues 발견된 문제
 */
public record DeviceHealth(HealthStatus status, List<String> issues) {

    public DeviceHealth {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    public static DeviceHealth healthy() {
        return new DeviceHealth(HealthStatus.HEALTHY, List.of());
    }

    /**
     * 점검 실패를 unknown 상태로 표현.
     */
    public static DeviceHealth unknown(String issue) {
        return new DeviceHealth(HealthStatus.UNKNOWN, List.of(issue == null ? "unknown error" : issue));
    }
}
