/**
 * Declarative schema model and validator for dynamic unit input.
 *
 * <p>{@link com.ryuqq.asms.core.schema.Schema} checks required fields, types, enums, numeric bounds,
 * string length and full-match patterns. Violations surface as {@code invalid_input} errors naming
 * the offending field path.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.asms.core.schema;
