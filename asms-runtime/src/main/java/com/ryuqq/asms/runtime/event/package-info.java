/**
 * Event publisher implementations: SLF4J audit log, asynchronous decoupling and an in-memory bus.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.asms.runtime.event;
