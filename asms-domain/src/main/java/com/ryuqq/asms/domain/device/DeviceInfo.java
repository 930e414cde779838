package com.ryuqq.asms.domain.device;

import java.util.List;

/**
 * 하드웨어 장치 정보.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param id 장치 ID (예: gpu-0)
 * @param name 이름
 * @param vendor 제조사
 * @param type 장치 종류 (gpu, npu, cpu ...)
 * @param architecture 아키텍처 (빈 문자열 가능)
 * @param memory 메모리 (MiB, 0 = 알 수 없음)
 * @param capabilities 지원 기능
 */
public record DeviceInfo(
    String id,
    String name,
    String vendor,
    String type,
    String architecture,
    long memory,
    List<String> capabilities
) {

    public DeviceInfo {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        architecture = architecture == null ? "" : architecture;
        capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
    }
}
