package com.ryuqq.asms.domain.service;

import java.util.Optional;

/**
 * 서비스에 할당되는 자원 등급.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ResourceClass {

    SMALL("small"),
    MEDIUM("medium"),
    LARGE("large");

    private final String value;

    ResourceClass(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Optional<ResourceClass> fromValue(String value) {
        for (ResourceClass resourceClass : values()) {
            if (resourceClass.value.equals(value)) {
                return Optional.of(resourceClass);
            }
        }
        return Optional.empty();
    }

    static Object[] tokens() {
        ResourceClass[] all = values();
        Object[] tokens = new Object[all.length];
        for (int i = 0; i < all.length; i++) {
            tokens[i] = all[i].value;
        }
        return tokens;
    }

    @Override
    public String toString() {
        return value;
    }
}
