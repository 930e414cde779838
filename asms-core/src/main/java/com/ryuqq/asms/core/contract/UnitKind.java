package com.ryuqq.asms.core.contract;

/**
 * Unit 종류.
 *
 * <p>Command와 Query는 형태가 같고 의미만 다릅니다 (Query는 읽기 전용).</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum UnitKind {
    COMMAND,
    QUERY
}
