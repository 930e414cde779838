package com.ryuqq.asms.core.contract;

/**
 * Read-only unit.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Query extends Unit {

    @Override
    default UnitKind kind() {
        return UnitKind.QUERY;
    }
}
