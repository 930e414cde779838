package com.ryuqq.asms.domain.inference;

import com.ryuqq.asms.core.contract.Resource;
import com.ryuqq.asms.core.contract.ResourceFactory;
import com.ryuqq.asms.core.error.ErrorCode;
import com.ryuqq.asms.core.error.UnitException;

/**
 * {@code asms://inference/models} Resource 팩토리.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class InferenceResourceFactory implements ResourceFactory {

    private final InferenceModelsResource models;

    public InferenceResourceFactory(InferenceModelsResource models) {
        if (models == null) {
            throw new IllegalArgumentException("models resource cannot be null");
        }
        this.models = models;
    }

    @Override
    public boolean canCreate(String uri) {
        return InferenceModelsResource.URI.equals(uri);
    }

    @Override
    public Resource create(String uri) {
        if (!canCreate(uri)) {
            throw UnitException.of(InferenceEvents.DOMAIN, ErrorCode.NOT_FOUND, "unknown inference resource: " + uri);
        }
        return models;
    }

    @Override
    public String pattern() {
        return InferenceModelsResource.URI;
    }
}
