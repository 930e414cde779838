package com.ryuqq.asms.core.context;

/**
 * Handle to a registration or subscription that can be cancelled.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Cancellable {

    /**
     * Cancels the registration.
     *
     * @return true if this call cancelled it, false if it was already cancelled
     */
    boolean cancel();
}
