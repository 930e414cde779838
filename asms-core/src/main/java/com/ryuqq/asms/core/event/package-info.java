/**
 * Execution lifecycle and domain events.
 *
 * <p>Publishing is best-effort: a failing {@link com.ryuqq.asms.core.event.EventPublisher} never fails
 * the unit that produced the event.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.asms.core.event;
