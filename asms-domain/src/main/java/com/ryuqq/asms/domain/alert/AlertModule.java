package com.ryuqq.asms.domain.alert;

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
 * 알림 도메인 구성.
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * AlertModule alerts = new AlertModule(new InMemoryAlertStore(clock), publisher, poller, new WatchConfig(), clock);
 * alerts.registerInto(registry);
 * alerts.trigger().fire(ctx, ruleId, "CPU over 80%", Map.of("cpu", 91.5));
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class AlertModule implements DomainModule {

    private final AlertStore store;
    private final List<Command> commands;
    private final List<Query> queries;
    private final AlertResource rules;
    private final AlertResource active;
    private final AlertResourceFactory factory;
    private final AlertTrigger trigger;

    public AlertModule(
        AlertStore store,
        EventPublisher publisher,
        ResourcePoller poller,
        WatchConfig config,
        Clock clock
    ) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.store = store;
        this.commands = new AlertCommands(store, publisher, clock).all();
        this.queries = new AlertQueries(store, publisher, clock).all();
        this.rules = AlertResource.rules(store, poller, config);
        this.active = AlertResource.active(store, poller, config);
        this.factory = new AlertResourceFactory(rules, active);
        this.trigger = new AlertTrigger(store, publisher, clock);
    }

    @Override
    public String domain() {
        return AlertEvents.DOMAIN;
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
        return List.of(rules, active);
    }

    @Override
    public List<ResourceFactory> resourceFactories() {
        return List.of(factory);
    }

    public AlertStore store() {
        return store;
    }

    public AlertTrigger trigger() {
        return trigger;
    }
}
