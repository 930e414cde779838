package com.ryuqq.asms.domain.inference;

import com.ryuqq.asms.core.contract.Command;
import com.ryuqq.asms.core.contract.Query;
import com.ryuqq.asms.core.contract.Resource;
import com.ryuqq.asms.core.contract.ResourceFactory;
import com.ryuqq.asms.core.event.EventPublisher;
import com.ryuqq.asms.core.registry.DomainModule;
import com.ryuqq.asms.runtime.stream.StreamBridge;
import com.ryuqq.asms.runtime.watch.ResourcePoller;
import com.ryuqq.asms.runtime.watch.WatchConfig;

import java.time.Clock;
import java.util.List;

/**
 * 추론 도메인 구성.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class InferenceModule implements DomainModule {

    private final List<Command> commands;
    private final List<Query> queries;
    private final InferenceModelsResource models;
    private final InferenceResourceFactory factory;

    public InferenceModule(
        InferenceProvider provider,
        StreamBridge streamBridge,
        EventPublisher publisher,
        ResourcePoller poller,
        WatchConfig config,
        Clock clock
    ) {
        this.commands = new InferenceCommands(provider, streamBridge, publisher, clock).all();
        this.queries = new InferenceQueries(provider, publisher, clock).all();
        this.models = new InferenceModelsResource(provider, poller, config);
        this.factory = new InferenceResourceFactory(models);
    }

    @Override
    public String domain() {
        return InferenceEvents.DOMAIN;
    }

    @Override
    public List<Command> commands() {
        return commands;
    }

    @Override
    public List<Query> queries() {
        return queries;
    }

    @Override
    public List<Resource> resources() {
        return List.of(models);
    }

    @Override
    public List<ResourceFactory> resourceFactories() {
        return List.of(factory);
    }
}
