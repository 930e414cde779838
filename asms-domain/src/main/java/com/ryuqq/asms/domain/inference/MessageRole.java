package com.ryuqq.asms.domain.inference;

import java.util.Optional;

/**
 * 대화 메시지 역할.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum MessageRole {

    SYSTEM("system"),
    USER("user"),
    ASSISTANT("assistant");

    private final String value;

    MessageRole(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Optional<MessageRole> fromValue(String value) {
        for (MessageRole role : values()) {
            if (role.value.equals(value)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }

    static Object[] tokens() {
        MessageRole[] roles = values();
        Object[] tokens = new Object[roles.length];
        for (int i = 0; i < roles.length; i++) {
            tokens[i] = roles[i].value;
        }
        return tokens;
    }
}
