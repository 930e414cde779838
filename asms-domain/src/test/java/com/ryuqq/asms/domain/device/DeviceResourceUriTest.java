package com.ryuqq.asms.domain.device;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * DeviceResourceUri 파싱 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class DeviceResourceUriTest {

    @ParameterizedTest
    @EnumSource(DeviceResourceType.class)
    void parse_FormattedUri_ReturnsSameTypeAndId(DeviceResourceType type) {
        // Given
        String uri = DeviceResourceUri.of(type, "gpu-0").toUri();

        // When
        Optional<DeviceResourceUri> parsed = DeviceResourceUri.parse(uri);

        // Then
        assertTrue(parsed.isPresent());
        assertEquals(type, parsed.get().type());
        assertEquals("gpu-0", parsed.get().deviceId());
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "",
        "asms://device/",
        "asms://device/gpu-0",
        "asms://device//info",
        "asms://device/gpu-0/info/extra",
        "asms://device/gpu-0/temperature",
        "asms://devices/gpu-0/info",
        "device/gpu-0/info"
    })
    void parse_MalformedUri_ReturnsEmpty(String uri) {
        assertFalse(DeviceResourceUri.parse(uri).isPresent());
    }

    @Test
    void parse_NullUri_ReturnsEmpty() {
        assertFalse(DeviceResourceUri.parse(null).isPresent());
    }

    @Test
    void constructor_SlashInDeviceId_ThrowsException() {
        assertThrows(IllegalArgumentException.class,
            () -> DeviceResourceUri.of(DeviceResourceType.INFO, "a/b"));
    }

    @Test
    void toUri_ReturnsCanonicalForm() {
        assertEquals("asms://device/npu-1/health",
            DeviceResourceUri.of(DeviceResourceType.HEALTH, "npu-1").toUri());
    }
}
