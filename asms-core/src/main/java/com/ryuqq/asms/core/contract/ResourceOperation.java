package com.ryuqq.asms.core.contract;

/**
 * Resource 변경 알림의 종류.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ResourceOperation {

    REFRESH("refresh"),
    UPDATE("update"),
    STATUS_CHANGED("status_changed"),
    HEALTH_CHANGED("health_changed"),
    MODELS_CHANGED("models_changed"),
    ERROR("error");

    private final String value;

    ResourceOperation(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
