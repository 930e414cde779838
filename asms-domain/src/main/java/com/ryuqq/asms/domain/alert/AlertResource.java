package com.ryuqq.asms.domain.alert;

import com.ryuqq.asms.core.context.CallContext;
import com.ryuqq.asms.core.contract.Resource;
import com.ryuqq.asms.core.contract.ResourceOperation;
import com.ryuqq.asms.core.contract.ResourceUris;
import com.ryuqq.asms.core.contract.ResourceWatch;
import com.ryuqq.asms.core.schema.Schema;
import com.ryuqq.asms.runtime.watch.ChangeDetector;
import com.ryuqq.asms.runtime.watch.ResourceFetcher;
import com.ryuqq.asms.runtime.watch.ResourcePoller;
import com.ryuqq.asms.runtime.watch.WatchConfig;
import com.ryuqq.asms.runtime.watch.WatcherList;

import java.util.Map;

/**
 * 알림 Resource ({@code asms://alerts/rules}, {@code asms://alerts/active}).
 *
 * <p>구독자는 하나의 공유 poll 작업을 통해 알림을 받으며, 변화 여부와 관계없이 매 tick마다
 * rules는 {@code refresh}, active는 {@code update}를 전달합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class AlertResource implements Resource {

    public static final String RULES_URI = ResourceUris.of("alerts", "rules");
    public static final String ACTIVE_URI = ResourceUris.of("alerts", "active");

    private final String uri;
    private final Schema schema;
    private final ResourceFetcher fetcher;
    private final WatcherList watchers;

    private AlertResource(
        String uri,
        Schema schema,
        ResourceFetcher fetcher,
        ResourcePoller poller,
        long intervalMs,
        int capacity,
        ResourceOperation operation
    ) {
        this.uri = uri;
        this.schema = schema;
        this.fetcher = fetcher;
        this.watchers = new WatcherList(poller, uri, intervalMs, capacity, fetcher,
            () -> ChangeDetector.always(operation));
    }

    /**
     * 규칙 목록 Resource.
     */
    public static AlertResource rules(AlertStore store, ResourcePoller poller, WatchConfig config) {
        return new AlertResource(RULES_URI, AlertQueries.LIST_RULES.outputSchema(),
            ctx -> Map.of("rules", AlertViews.rules(store.listRules(ctx, RuleFilter.ALL))),
            poller, config.rulesIntervalMs(), config.bufferCapacity(), ResourceOperation.REFRESH);
    }

    /**
     * 활성 알림 Resource.
     */
    public static AlertResource active(AlertStore store, ResourcePoller poller, WatchConfig config) {
        return new AlertResource(ACTIVE_URI, AlertQueries.ACTIVE.outputSchema(),
            ctx -> Map.of("alerts", AlertViews.alerts(store.listActiveAlerts(ctx))),
            poller, config.activeAlertsIntervalMs(), config.bufferCapacity(), ResourceOperation.UPDATE);
    }

    @Override
    public String uri() {
        return uri;
    }

    @Override
    public String domain() {
        return AlertEvents.DOMAIN;
    }

    @Override
    public Schema schema() {
        return schema;
    }

    @Override
    public Object get(CallContext ctx) {
        return fetcher.fetch(ctx);
    }

    @Override
    public ResourceWatch watch(CallContext ctx) {
        return watchers.subscribe(ctx);
    }

    int watcherCount() {
        return watchers.size();
    }

    @Override
    public String toString() {
        return "AlertResource{uri=" + uri + "}";
    }
}
