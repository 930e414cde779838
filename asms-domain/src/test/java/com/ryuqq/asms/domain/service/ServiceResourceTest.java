package com.ryuqq.asms.domain.service;

import com.ryuqq.asms.core.context.CallContext;
import com.ryuqq.asms.core.contract.Resource;
import com.ryuqq.asms.core.contract.ResourceOperation;
import com.ryuqq.asms.core.contract.ResourceUpdate;
import com.ryuqq.asms.core.contract.ResourceWatch;
import com.ryuqq.asms.core.error.ErrorCode;
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
 * 서비스 Resource 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ServiceResourceTest {

    private static final String SERVICE_ID = "svc-mock-llama3";

    private final Clock clock = Clock.systemUTC();
    private final ResourcePoller poller = new ResourcePoller(2, clock);
    private final InMemoryServiceStore store = new InMemoryServiceStore(clock);
    private final ServiceModule module =
        new ServiceModule(store, new MockServiceProvider(), null, poller, WatchConfig.uniform(20), clock);
    private final UnitRegistry registry = new UnitRegistry();
    private final CallContext ctx = CallContext.background();

    @AfterEach
    void tearDown() throws InterruptedException {
        poller.shutdown();
    }

    @Test
    void 모듈_등록_후_URI로_해석() {
        module.registerInto(registry);

        Resource services = registry.resolveResource("asms://services");
        Resource single = registry.resolveResource("asms://service/" + SERVICE_ID);

        assertThat(services).isSameAs(module.resources().get(0));
        assertThat(single.uri()).isEqualTo("asms://service/" + SERVICE_ID);
        assertThat(registry.resolveResource("asms://service/" + SERVICE_ID)).isSameAs(single);
        assertThat(registry.getCommand("service.start")).isPresent();
        assertThat(registry.getQuery("service.recommend")).isPresent();
    }

    @Test
    void 잘못된_서비스_URI() {
        ServiceResourceFactory factory = (ServiceResourceFactory) module.resourceFactories().get(0);

        assertThat(factory.canCreate("asms://service/")).isFalse();
        assertThat(factory.canCreate("asms://service/a/b")).isFalse();
        assertThat(factory.canCreate("asms://device/gpu-0/info")).isFalse();
        assertThat(factory.pattern()).isEqualTo("asms://service/*");
        assertThatThrownBy(() -> factory.create("asms://service/"))
            .satisfies(e -> assertThat(UnitException.isNotFound(e)).isTrue());
    }

    @Test
    void 없는_서비스_읽기는_service_not_found() {
        module.registerInto(registry);
        Resource single = registry.resolveResource("asms://service/svc-x-y");

        assertThatThrownBy(() -> single.get(ctx))
            .satisfies(e -> assertThat(UnitException.hasCode(e, ErrorCode.SERVICE_NOT_FOUND)).isTrue());
    }

    @Test
    void pending에서_running으로_바뀌면_status_changed() throws InterruptedException {
        // given
        store.create(ctx, ModelService.of(SERVICE_ID, "llama3", ResourceClass.MEDIUM, 1, List.of()));
        module.registerInto(registry);
        CallContext watchCtx = CallContext.background().withCancel();
        ResourceWatch watch = registry.resolveResource("asms://service/" + SERVICE_ID).watch(watchCtx);
        ResourceUpdate first = watch.poll(2, TimeUnit.SECONDS);
        assertThat(first.operation()).isEqualTo(ResourceOperation.REFRESH);

        // when
        store.update(ctx, store.get(ctx, SERVICE_ID).withStatus(ServiceStatus.RUNNING));

        // then
        ResourceUpdate changed = nextNonRefresh(watch);
        assertThat(changed.operation()).isEqualTo(ResourceOperation.STATUS_CHANGED);
        assertThat(changed.data()).isInstanceOfSatisfying(Map.class,
            data -> assertThat(data.get("status")).isEqualTo("running"));
        watchCtx.cancel();
    }

    @Test
    @SuppressWarnings("unchecked")
    void 서비스_목록은_항상_refresh() throws InterruptedException {
        // given
        CallContext watchCtx = CallContext.background().withCancel();
        ResourceWatch watch = module.resources().get(0).watch(watchCtx);
        assertThat(watch.poll(2, TimeUnit.SECONDS).operation()).isEqualTo(ResourceOperation.REFRESH);

        // when
        store.create(ctx, ModelService.of(SERVICE_ID, "llama3", ResourceClass.MEDIUM, 1, List.of()));

        // then
        ResourceUpdate update = nextWithTotal(watch, 1);
        assertThat(update.operation()).isEqualTo(ResourceOperation.REFRESH);
        assertThat((List<Map<String, Object>>) ((Map<String, Object>) update.data()).get("services"))
            .extracting(service -> service.get("id"))
            .containsExactly(SERVICE_ID);
        watchCtx.cancel();
    }

    private static ResourceUpdate nextNonRefresh(ResourceWatch watch) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
        while (System.nanoTime() < deadline) {
            ResourceUpdate update = watch.poll(100, TimeUnit.MILLISECONDS);
            if (update != null && update.operation() != ResourceOperation.REFRESH) {
                return update;
            }
        }
        throw new AssertionError("no non-refresh update within 2s");
    }

    @SuppressWarnings("unchecked")
    private static ResourceUpdate nextWithTotal(ResourceWatch watch, int total) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
        while (System.nanoTime() < deadline) {
            ResourceUpdate update = watch.poll(100, TimeUnit.MILLISECONDS);
            if (update != null && !update.isError()
                && Integer.valueOf(total).equals(((Map<String, Object>) update.data()).get("total"))) {
                return update;
            }
        }
        throw new AssertionError("no update with total " + total + " within 2s");
    }
}
