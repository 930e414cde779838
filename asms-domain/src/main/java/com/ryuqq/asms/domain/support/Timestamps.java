package com.ryuqq.asms.domain.support;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Wire timestamp formatting (RFC-3339 with offset).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Timestamps {

    // Utility class - prevent instantiation
    private Timestamps() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * @return RFC-3339 text in UTC, or null when {@code instant} is null
     */
    public static String format(Instant instant) {
        return instant == null ? null : DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(instant.atOffset(ZoneOffset.UTC));
    }
}
