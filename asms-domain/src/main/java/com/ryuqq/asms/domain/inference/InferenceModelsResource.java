package com.ryuqq.asms.domain.inference;

import com.ryuqq.asms.core.context.CallContext;
import com.ryuqq.asms.core.contract.ResourceOperation;
import com.ryuqq.asms.core.contract.ResourceUris;
import com.ryuqq.asms.core.error.UnitException;
import com.ryuqq.asms.runtime.watch.AbstractPollingResource;
import com.ryuqq.asms.runtime.watch.ChangeDetector;
import com.ryuqq.asms.runtime.watch.ResourcePoller;
import com.ryuqq.asms.runtime.watch.WatchConfig;

/**
 * 사용 가능한 모델 목록 Resource ({@code asms://inference/models}).
 *
 * <p>모델 수가 바뀌면 {@code models_changed}, 아니면 {@code refresh}를 전달합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class InferenceModelsResource extends AbstractPollingResource {

    public static final String URI = ResourceUris.of(InferenceEvents.DOMAIN, "models");

    private final InferenceProvider provider;

    public InferenceModelsResource(InferenceProvider provider, ResourcePoller poller, WatchConfig config) {
        super(URI, InferenceEvents.DOMAIN, InferenceQueries.MODELS_OUTPUT, poller,
            config.inferenceModelsIntervalMs(), config.bufferCapacity());
        this.provider = provider;
    }

    @Override
    public Object get(CallContext ctx) {
        InferenceProvider p = InferenceCommands.requireProvider(provider);
        try {
            return InferenceViews.models(p.listModels(ctx, null));
        } catch (UnitException e) {
            throw UnitException.wrap("get models", e);
        }
    }

    @Override
    protected ChangeDetector newChangeDetector() {
        return ChangeDetector.onSizeChange("models", ResourceOperation.MODELS_CHANGED);
    }
}
