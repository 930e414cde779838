package com.ryuqq.asms.domain.device;

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
 * 장치 도메인 구성.
 *
 * <p>장치별 Resource는 정적으로 등록하지 않고 팩토리를 통해 URI로 생성됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DeviceModule implements DomainModule {

    private final List<Command> commands;
    private final List<Query> queries;
    private final DeviceResourceFactory factory;

    public DeviceModule(
        DeviceProvider provider,
        DeviceMetricsThresholds thresholds,
        EventPublisher publisher,
        ResourcePoller poller,
        WatchConfig config,
        Clock clock
    ) {
        this.commands = new DeviceCommands(provider, publisher, clock).all();
        this.queries = new DeviceQueries(provider, thresholds, publisher, clock).all();
        this.factory = new DeviceResourceFactory(new DeviceResources(provider, poller, config, publisher, clock));
    }

    @Override
    public String domain() {
        return DeviceEvents.DOMAIN;
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
        return List.of();
    }

    @Override
    public List<ResourceFactory> resourceFactories() {
        return List.of(factory);
    }
}
