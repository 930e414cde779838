/**
 * Per-call cancellation tokens with deadlines and request metadata.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.asms.core.context;
