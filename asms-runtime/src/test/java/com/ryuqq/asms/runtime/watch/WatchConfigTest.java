package com.ryuqq.asms.runtime.watch;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * WatchConfig 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class WatchConfigTest {

    @Test
    void defaultConstructor_UsesDocumentedIntervals() {
        // When
        WatchConfig config = new WatchConfig();

        // Then
        assertEquals(30000, config.rulesIntervalMs());
        assertEquals(5000, config.activeAlertsIntervalMs());
        assertEquals(30000, config.deviceInfoIntervalMs());
        assertEquals(5000, config.deviceMetricsIntervalMs());
        assertEquals(10000, config.deviceHealthIntervalMs());
        assertEquals(60000, config.inferenceModelsIntervalMs());
        assertEquals(30000, config.serviceIntervalMs());
        assertEquals(60000, config.servicesListIntervalMs());
        assertEquals(10, config.bufferCapacity());
    }

    @Test
    void uniform_SetsEveryInterval() {
        WatchConfig config = WatchConfig.uniform(25);

        assertEquals(25, config.rulesIntervalMs());
        assertEquals(25, config.servicesListIntervalMs());
    }

    @Test
    void constructor_NonPositiveInterval_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new WatchConfig().withServiceIntervalMs(0)
        );
        assertTrue(exception.getMessage().contains("serviceIntervalMs must be positive"));
    }

    @Test
    void constructor_SmallBuffer_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new WatchConfig().withBufferCapacity(5));
    }
}
