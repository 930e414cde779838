/**
 * Transport-facing dispatch layer.
 *
 * <p>Turns a unit name or resource URI plus a dynamic input into a registry lookup,
 * schema validation and execution. Transports (HTTP, MCP, CLI) only depend on
 * {@link com.ryuqq.asms.application.dispatch.Dispatcher}.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.asms.application.dispatch.Dispatcher} - entry point contract</li>
 *   <li>{@link com.ryuqq.asms.application.dispatch.UnitDispatcher} - registry-backed implementation</li>
 *   <li>{@link com.ryuqq.asms.application.dispatch.DispatchConfig} - input/output validation switches</li>
 *   <li>{@link com.ryuqq.asms.application.dispatch.CatalogEntry} - discovery listing entry</li>
 * </ul>
 *
 * <h2>Errors</h2>
 * <p>Failures propagate as {@link com.ryuqq.asms.core.error.UnitException}; transports map them with
 * {@link com.ryuqq.asms.application.dispatch.Dispatcher#toErrorResponse(Throwable)}.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.asms.application.dispatch;
