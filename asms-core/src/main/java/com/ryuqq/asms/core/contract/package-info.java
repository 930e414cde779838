/**
 * Unit and Resource contract package.
 *
 * <p>This package defines the uniform contracts every domain implements so that a transport
 * can discover, validate and execute operations without knowing their domain:</p>
 *
 * <h2>Units</h2>
 * <ul>
 *   <li>{@link com.ryuqq.asms.core.contract.Command} - Operation that may change state</li>
 *   <li>{@link com.ryuqq.asms.core.contract.Query} - Read-only operation</li>
 *   <li>{@link com.ryuqq.asms.core.contract.StreamingCommand} - Command producing incremental frames</li>
 *   <li>{@link com.ryuqq.asms.core.contract.Units} - Handler-based factory that wraps execution events</li>
 * </ul>
 *
 * <h2>Resources</h2>
 * <ul>
 *   <li>{@link com.ryuqq.asms.core.contract.Resource} - URI-addressed state with get/watch</li>
 *   <li>{@link com.ryuqq.asms.core.contract.ResourceWatch} - Receiving side of a subscription</li>
 *   <li>{@link com.ryuqq.asms.core.contract.ResourceFactory} - Creates resources for dynamic URIs</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Dynamic I/O:</strong> Inputs and outputs are key/value maps described by schemas</li>
 *   <li><strong>Cancellation:</strong> Every call takes a {@link com.ryuqq.asms.core.context.CallContext}</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.asms.core.contract;
