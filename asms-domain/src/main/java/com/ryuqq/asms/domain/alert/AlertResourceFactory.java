package com.ryuqq.asms.domain.alert;

import com.ryuqq.asms.core.contract.Resource;
import com.ryuqq.asms.core.contract.ResourceFactory;
import com.ryuqq.asms.core.contract.ResourceUris;
import com.ryuqq.asms.core.error.ErrorCode;
import com.ryuqq.asms.core.error.UnitException;

/**
 * {@code asms://alerts/*} Resource 팩토리.
 *
 * <p>같은 URI에 대해 항상 같은 인스턴스를 반환하므로 구독자들이 하나의 poll 작업을 공유합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class AlertResourceFactory implements ResourceFactory {

    private static final String PREFIX = ResourceUris.SCHEME + "alerts/";

    private final AlertResource rules;
    private final AlertResource active;

    public AlertResourceFactory(AlertResource rules, AlertResource active) {
        if (rules == null || active == null) {
            throw new IllegalArgumentException("rules and active resources cannot be null");
        }
        this.rules = rules;
        this.active = active;
    }

    @Override
    public boolean canCreate(String uri) {
        return AlertResource.RULES_URI.equals(uri) || AlertResource.ACTIVE_URI.equals(uri);
    }

    @Override
    public Resource create(String uri) {
        if (AlertResource.RULES_URI.equals(uri)) {
            return rules;
        }
        if (AlertResource.ACTIVE_URI.equals(uri)) {
            return active;
        }
        throw UnitException.of(AlertEvents.DOMAIN, ErrorCode.NOT_FOUND, "unknown alert resource: " + uri);
    }

    @Override
    public String pattern() {
        return PREFIX + "*";
    }
}
