package com.ryuqq.asms.core.contract;

/**
 * 상태를 변경할 수 있는 Unit.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Command extends Unit {

    @Override
    default UnitKind kind() {
        return UnitKind.COMMAND;
    }

    /**
     * 스트리밍 실행 지원 여부.
     *
     * @return {@link StreamingCommand}이면 true
     */
    default boolean supportsStreaming() {
        return false;
    }
}
