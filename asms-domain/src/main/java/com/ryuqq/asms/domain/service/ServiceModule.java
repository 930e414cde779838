package com.ryuqq.asms.domain.service;

import com.ryuqq.asms.core.contract.Command;
import com.ryuqq.asms.core.contract.Query;
import com.ryuqq.asms.core.contract.Resource;
import com.ryuqq.asms.core.contract.ResourceFactory;
import com.ryuqq.asms.core.event.EventPublisher;
import com.ryuqq.asms.core.registry.DomainModule;
import com.ryuqq.asms.runtime.watch.ResourcePoller;
import com.ryuqq.asms.runtime.watch.WatchConfig;

import java.time.Clock;
import java.util.List;

/**
 * 서비스 도메인 구성.
 *
 * <p>서비스 목록 Resource는 정적으로 등록되고, 서비스별 Resource는 팩토리가 URI로 생성합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ServiceModule implements DomainModule {

    private final List<Command> commands;
    private final List<Query> queries;
    private final ServicesResource services;
    private final ServiceResourceFactory factory;

    public ServiceModule(
        ServiceStore store,
        ServiceProvider provider,
        EventPublisher publisher,
        ResourcePoller poller,
        WatchConfig config,
        Clock clock
    ) {
        this.commands = new ServiceCommands(store, provider, publisher, clock).all();
        this.queries = new ServiceQueries(store, provider, publisher, clock).all();
        this.services = new ServicesResource(store, poller, config);
        this.factory = new ServiceResourceFactory(store, services, poller, config);
    }

    @Override
    public String domain() {
        return ServiceEvents.DOMAIN;
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
        return List.of(services);
    }

    @Override
    public List<ResourceFactory> resourceFactories() {
        return List.of(factory);
    }
}
