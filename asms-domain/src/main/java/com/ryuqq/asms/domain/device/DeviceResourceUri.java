package com.ryuqq.asms.domain.device;

import com.ryuqq.asms.core.contract.ResourceUris;

import java.util.Optional;

/**
 * {@code asms://device/<deviceId>/<type>} URI 값.
 *
 * <p><strong>파싱 규칙:</strong></p>
 * <ul>
 *   <li>접두사 {@code asms://device/} 필수</li>
 *   <li>나머지는 정확히 두 구간 (장치 ID, 종류)</li>
 *   <li>장치 ID는 비어 있을 수 없음</li>
 *   <li>종류는 info, metrics, health 중 하나</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param type Resource 종류
 * @param deviceId 장치 ID
 */
public record DeviceResourceUri(DeviceResourceType type, String deviceId) {

    public static final String PREFIX = ResourceUris.SCHEME + "device/";

    public DeviceResourceUri {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (deviceId == null || deviceId.isEmpty() || deviceId.contains("/")) {
            throw new IllegalArgumentException("deviceId must be a non-empty path segment (current: " + deviceId + ")");
        }
    }

    public static DeviceResourceUri of(DeviceResourceType type, String deviceId) {
        return new DeviceResourceUri(type, deviceId);
    }

    /**
     * URI 파싱.
     *
     * @param uri 대상 URI (nullable)
     * @return 파싱 결과, 형식이 맞지 않으면 empty
     */
    public static Optional<DeviceResourceUri> parse(String uri) {
        String rest = ResourceUris.stripPrefix(uri, PREFIX);
        if (rest == null) {
            return Optional.empty();
        }
        String[] parts = rest.split("/", -1);
        if (parts.length != 2 || parts[0].isEmpty()) {
            return Optional.empty();
        }
        return DeviceResourceType.fromValue(parts[1]).map(type -> new DeviceResourceUri(type, parts[0]));
    }

    public String toUri() {
        return PREFIX + deviceId + "/" + type.getValue();
    }

    @Override
    public String toString() {
        return toUri();
    }
}
