/**
 * Name and URI lookup of units and resources.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.asms.core.registry;
