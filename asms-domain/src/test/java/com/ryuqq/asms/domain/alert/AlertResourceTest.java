package com.ryuqq.asms.domain.alert;

import com.ryuqq.asms.core.context.CallContext;
import com.ryuqq.asms.core.contract.ResourceOperation;
import com.ryuqq.asms.core.contract.ResourceUpdate;
import com.ryuqq.asms.core.contract.ResourceWatch;
import com.ryuqq.asms.core.error.UnitException;
import com.ryuqq.asms.core.registry.UnitRegistry;
import com.ryuqq.asms.runtime.watch.ResourcePoller;
import com.ryuqq.asms.runtime.watch.WatchConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 알림 Resource와 모듈 등록 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class AlertResourceTest {

    private final Clock clock = Clock.systemUTC();
    private final ResourcePoller poller = new ResourcePoller(2, clock);
    private final InMemoryAlertStore store = new InMemoryAlertStore(clock);
    private final AlertModule module = new AlertModule(store, null, poller, WatchConfig.uniform(20), clock);

    @AfterEach
    void tearDown() throws InterruptedException {
        poller.shutdown();
    }

    @Test
    @SuppressWarnings("unchecked")
    void rules_get은_현재_규칙_스냅샷() {
        store.createRule(CallContext.background(),
            AlertRule.create("A", "x > 1", AlertSeverity.INFO, List.of(), 0));
        AlertResource rules = AlertResource.rules(store, poller, new WatchConfig());

        Map<String, Object> snapshot = (Map<String, Object>) rules.get(CallContext.background());

        assertThat(rules.uri()).isEqualTo("asms://alerts/rules");
        assertThat((List<Object>) snapshot.get("rules")).hasSize(1);
    }

    @Test
    void active_watch는_매_tick마다_update_전달() throws InterruptedException {
        // given
        UnitRegistry registry = new UnitRegistry();
        module.registerInto(registry);
        CallContext ctx = CallContext.background().withCancel();

        // when
        ResourceWatch watch = registry.resolveResource("asms://alerts/active").watch(ctx);
        ResourceUpdate first = watch.poll(2, TimeUnit.SECONDS);
        ResourceUpdate second = watch.poll(2, TimeUnit.SECONDS);

        // then
        assertThat(first.operation()).isEqualTo(ResourceOperation.UPDATE);
        assertThat(second.operation()).isEqualTo(ResourceOperation.UPDATE);
        ctx.cancel();
    }

    @Test
    void rules_구독자들은_독립적인_버퍼를_가짐() throws InterruptedException {
        // given
        AlertResource rules = (AlertResource) module.resources().get(0);
        CallContext firstCtx = CallContext.background().withCancel();
        ResourceWatch first = rules.watch(firstCtx);
        ResourceWatch second = rules.watch(CallContext.background());

        // when
        firstCtx.cancel();
        while (first.poll(10, TimeUnit.MILLISECONDS) != null) {
            // drain what was buffered before cancellation
        }
        ResourceUpdate update = second.poll(2, TimeUnit.SECONDS);

        // then
        assertThat(first.isClosed()).isTrue();
        assertThat(update.operation()).isEqualTo(ResourceOperation.REFRESH);
        assertThat(rules.watcherCount()).isEqualTo(1);
        second.cancel();
    }

    @Test
    void factory는_같은_인스턴스를_반환하고_모르는_URI는_거부() {
        AlertResourceFactory factory = (AlertResourceFactory) module.resourceFactories().get(0);

        assertThat(factory.pattern()).isEqualTo("asms://alerts/*");
        assertThat(factory.create("asms://alerts/rules")).isSameAs(module.resources().get(0));
        assertThat(factory.canCreate("asms://alerts/other")).isFalse();
        assertThatThrownBy(() -> factory.create("asms://alerts/other")).isInstanceOf(UnitException.class);
    }

    @Test
    void 모듈은_8개_unit을_등록() {
        UnitRegistry registry = new UnitRegistry();

        module.registerInto(registry);

        assertThat(registry.listCommands()).hasSize(5);
        assertThat(registry.listQueries()).hasSize(3);
        assertThat(registry.listResources()).hasSize(2);
    }
}
