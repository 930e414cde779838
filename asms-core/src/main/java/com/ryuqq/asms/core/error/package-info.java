/**
 * Error taxonomy shared by all domains.
 *
 * <h2>Categories</h2>
 * <ul>
 *   <li><strong>INPUT:</strong> caller error, 400</li>
 *   <li><strong>NOT_FOUND:</strong> missing entity, 404</li>
 *   <li><strong>CONFLICT:</strong> duplicate entity, 409</li>
 *   <li><strong>OPERATION / INTERNAL:</strong> everything else, 500</li>
 * </ul>
 *
 * <p>{@link com.ryuqq.asms.core.error.UnitException#find(Throwable)} walks the cause chain,
 * so wrapping with context preserves the original code.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.asms.core.error;
