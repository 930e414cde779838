/**
 * Bridges provider streams into caller-owned bounded queues with one worker per stream.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.asms.runtime.stream;
