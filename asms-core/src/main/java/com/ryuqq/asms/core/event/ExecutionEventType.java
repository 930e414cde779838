package com.ryuqq.asms.core.event;

/**
 * Unit 실행 생명주기 이벤트 타입.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ExecutionEventType {

    STARTED("execution_started"),
    COMPLETED("execution_completed"),
    FAILED("execution_failed");

    private final String value;

    ExecutionEventType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this != STARTED;
    }
}
