package com.ryuqq.asms.domain.service;

import com.ryuqq.asms.core.context.CallContext;
import com.ryuqq.asms.core.context.ContextCancelledException;
import com.ryuqq.asms.core.error.ErrorCode;
import com.ryuqq.asms.core.error.UnitException;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryServiceStore 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class InMemoryServiceStoreTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private final CallContext ctx = CallContext.background();

    @Test
    void 생성시_시각이_설정되고_다시_읽으면_같은_서비스() {
        // given
        InMemoryServiceStore store = new InMemoryServiceStore(Clock.fixed(T0, ZoneOffset.UTC));

        // when
        ModelService created = store.create(ctx, service("svc-mock-llama3", "llama3"));

        // then
        assertThat(store.get(ctx, "svc-mock-llama3")).isEqualTo(created);
        assertThat(created.createdAt()).isEqualTo(T0);
        assertThat(created.updatedAt()).isEqualTo(T0);
        assertThat(store.getByName(ctx, "service-svc-mock-llama3").id()).isEqualTo("svc-mock-llama3");
    }

    @Test
    void 같은_ID로_생성하면_already_exists() {
        InMemoryServiceStore store = new InMemoryServiceStore();
        store.create(ctx, service("svc-mock-a", "a"));

        assertThatThrownBy(() -> store.create(ctx, service("svc-mock-a", "a")))
            .satisfies(e -> assertThat(UnitException.isAlreadyExists(e)).isTrue());
    }

    @Test
    void 갱신은_createdAt을_유지하고_updatedAt을_갱신() {
        // given
        SteppingClock stepping = new SteppingClock(T0);
        InMemoryServiceStore store = new InMemoryServiceStore(stepping);
        ModelService created = store.create(ctx, service("svc-mock-a", "a"));
        stepping.advanceSeconds(300);

        // when
        ModelService updated = store.update(ctx, created.withStatus(ServiceStatus.RUNNING));

        // then
        assertThat(updated.status()).isEqualTo(ServiceStatus.RUNNING);
        assertThat(updated.createdAt()).isEqualTo(T0);
        assertThat(updated.updatedAt()).isEqualTo(T0.plusSeconds(300));
    }

    @Test
    void 없는_서비스는_service_not_found() {
        InMemoryServiceStore store = new InMemoryServiceStore();

        assertThatThrownBy(() -> store.get(ctx, "missing"))
            .satisfies(e -> assertThat(UnitException.hasCode(e, ErrorCode.SERVICE_NOT_FOUND)).isTrue());
        assertThatThrownBy(() -> store.update(ctx, service("missing", "m")))
            .satisfies(e -> assertThat(UnitException.isNotFound(e)).isTrue());
        assertThatThrownBy(() -> store.delete(ctx, "missing"))
            .satisfies(e -> assertThat(UnitException.isNotFound(e)).isTrue());
        assertThatThrownBy(() -> store.getByName(ctx, "nobody"))
            .satisfies(e -> assertThat(UnitException.isNotFound(e)).isTrue());
    }

    // ==================== List ====================

    @Test
    void 필터와_페이지_total은_페이지와_무관() {
        // given
        InMemoryServiceStore store = new InMemoryServiceStore();
        store.create(ctx, service("svc-mock-a", "llama3").withStatus(ServiceStatus.RUNNING));
        store.create(ctx, service("svc-mock-b", "llama3").withStatus(ServiceStatus.RUNNING));
        store.create(ctx, service("svc-mock-c", "llama3").withStatus(ServiceStatus.STOPPED));
        store.create(ctx, service("svc-mock-d", "whisper").withStatus(ServiceStatus.RUNNING));

        // when
        ServicePage running = store.list(ctx, new ServiceFilter(ServiceStatus.RUNNING, null, 2, 0));
        ServicePage llama = store.list(ctx, new ServiceFilter(null, "llama3", 0, 1));
        ServicePage beyond = store.list(ctx, new ServiceFilter(null, null, 10, 99));

        // then
        assertThat(running.total()).isEqualTo(3);
        assertThat(running.services()).extracting(ModelService::id).containsExactly("svc-mock-a", "svc-mock-b");
        assertThat(llama.total()).isEqualTo(3);
        assertThat(llama.services()).extracting(ModelService::id).containsExactly("svc-mock-b", "svc-mock-c");
        assertThat(beyond.services()).isEmpty();
        assertThat(beyond.total()).isEqualTo(4);
    }

    @Test
    void 종료된_컨텍스트는_취소_예외() {
        InMemoryServiceStore store = new InMemoryServiceStore();
        CallContext cancelled = CallContext.background().withCancel();
        cancelled.cancel();

        assertThatThrownBy(() -> store.list(cancelled, ServiceFilter.ALL))
            .isInstanceOf(ContextCancelledException.class);
    }

    private static final class SteppingClock extends Clock {

        private Instant now;

        SteppingClock(Instant start) {
            this.now = start;
        }

        void advanceSeconds(long seconds) {
            now = now.plusSeconds(seconds);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }

    private static ModelService service(String id, String modelId) {
        return ModelService.of(id, modelId, ResourceClass.MEDIUM, 1, List.of(MockServiceProvider.ENDPOINT));
    }
}
