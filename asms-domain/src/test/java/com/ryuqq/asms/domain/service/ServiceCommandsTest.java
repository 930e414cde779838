package com.ryuqq.asms.domain.service;

import com.ryuqq.asms.core.context.CallContext;
import com.ryuqq.asms.core.context.ContextCancelledException;
import com.ryuqq.asms.core.error.ErrorCode;
import com.ryuqq.asms.core.error.UnitException;
import com.ryuqq.asms.core.event.Event;
import com.ryuqq.asms.runtime.event.InMemoryEventBus;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ServiceCommands 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ServiceCommandsTest {

    private static final String SERVICE_ID = "svc-mock-llama3";

    private final Clock clock = Clock.systemUTC();
    private final InMemoryServiceStore store = new InMemoryServiceStore(clock);
    private final MockServiceProvider provider = new MockServiceProvider();
    private final InMemoryEventBus bus = new InMemoryEventBus();
    private final ServiceCommands commands = new ServiceCommands(store, provider, bus, clock);
    private final CallContext ctx = CallContext.background();

    // ==================== create / delete ====================

    @Test
    void create_pending으로_저장하고_created_발행() {
        // when
        Map<String, Object> output = commands.create().execute(ctx,
            Map.of("model_id", "llama3", "resource_class", "large", "replicas", 2));

        // then
        assertThat(output).containsEntry("service_id", SERVICE_ID);
        ModelService stored = store.get(ctx, SERVICE_ID);
        assertThat(stored.status()).isEqualTo(ServiceStatus.PENDING);
        assertThat(stored.resourceClass()).isEqualTo(ResourceClass.LARGE);
        assertThat(stored.replicas()).isEqualTo(2);
        assertThat(stored.activeReplicas()).isZero();
        assertThat(stored.endpoints()).containsExactly(MockServiceProvider.ENDPOINT);

        List<Event> created = bus.eventsOfType(ServiceEvents.CREATED);
        assertThat(created).hasSize(1);
        assertThat(created.get(0).payload())
            .containsEntry("service_id", SERVICE_ID)
            .containsEntry("status", "pending")
            .containsEntry("resource_class", "large");
    }

    @Test
    void create_기본값은_medium_1개() {
        commands.create().execute(ctx, Map.of("model_id", "llama3"));

        ModelService stored = store.get(ctx, SERVICE_ID);
        assertThat(stored.resourceClass()).isEqualTo(ResourceClass.MEDIUM);
        assertThat(stored.replicas()).isEqualTo(1);
    }

    @Test
    void create_같은_서비스가_있으면_already_exists() {
        commands.create().execute(ctx, Map.of("model_id", "llama3"));

        assertThatThrownBy(() -> commands.create().execute(ctx, Map.of("model_id", "llama3")))
            .hasMessage("create service: service already exists: " + SERVICE_ID)
            .satisfies(e -> assertThat(UnitException.isAlreadyExists(e)).isTrue());
    }

    @Test
    void create_잘못된_입력() {
        assertThatThrownBy(() -> commands.create().execute(ctx, Map.of("model_id", "llama3", "resource_class", "huge")))
            .hasMessageContaining("invalid resource class: huge")
            .satisfies(e -> assertThat(UnitException.hasCode(e, ErrorCode.INVALID_INPUT)).isTrue());
        assertThatThrownBy(() -> commands.create().execute(ctx, Map.of("model_id", "llama3", "replicas", 0)))
            .satisfies(e -> assertThat(UnitException.hasCode(e, ErrorCode.INVALID_INPUT)).isTrue());
        assertThatThrownBy(() -> commands.create().execute(ctx, Map.of()))
            .satisfies(e -> assertThat(UnitException.hasCode(e, ErrorCode.INVALID_INPUT)).isTrue());
    }

    @Test
    void provider가_없으면_provider_not_set() {
        ServiceCommands withoutProvider = new ServiceCommands(store, null, bus, clock);

        assertThatThrownBy(() -> withoutProvider.create().execute(ctx, Map.of("model_id", "llama3")))
            .satisfies(e -> assertThat(UnitException.hasCode(e, ErrorCode.PROVIDER_NOT_SET)).isTrue());
    }

    @Test
    void delete_후_조회하면_not_found() {
        commands.create().execute(ctx, Map.of("model_id", "llama3"));

        Map<String, Object> output = commands.delete().execute(ctx, Map.of("service_id", SERVICE_ID));

        assertThat(output).containsEntry("success", true);
        assertThatThrownBy(() -> store.get(ctx, SERVICE_ID))
            .satisfies(e -> assertThat(UnitException.isNotFound(e)).isTrue());
        assertThatThrownBy(() -> commands.delete().execute(ctx, Map.of("service_id", SERVICE_ID)))
            .satisfies(e -> assertThat(UnitException.hasCode(e, ErrorCode.SERVICE_NOT_FOUND)).isTrue());
    }

    // ==================== start ====================

    @Test
    void start_running으로_전이하고_started_발행() {
        // given
        commands.create().execute(ctx, Map.of("model_id", "llama3", "replicas", 3));

        // when
        commands.start().execute(ctx, Map.of("service_id", SERVICE_ID));

        // then
        ModelService stored = store.get(ctx, SERVICE_ID);
        assertThat(stored.status()).isEqualTo(ServiceStatus.RUNNING);
        assertThat(stored.activeReplicas()).isEqualTo(3);
        assertThat(provider.isRunning(ctx, SERVICE_ID)).isTrue();
        assertThat(bus.eventsOfType(ServiceEvents.STARTED)).singleElement()
            .satisfies(event -> assertThat(event.payload())
                .containsEntry("status", "running")
                .containsEntry("endpoints", List.of(MockServiceProvider.ENDPOINT)));
    }

    @Test
    void start_이미_실행_중이면_already_exists() {
        commands.create().execute(ctx, Map.of("model_id", "llama3"));
        commands.start().execute(ctx, Map.of("service_id", SERVICE_ID));

        assertThatThrownBy(() -> commands.start().execute(ctx, Map.of("service_id", SERVICE_ID)))
            .satisfies(e -> assertThat(UnitException.isAlreadyExists(e)).isTrue());
        assertThat(provider.startCalls()).isEqualTo(1);
    }

    @Test
    void start_기록만_running이고_provider가_멈춰있으면_다시_시작() {
        // given
        commands.create().execute(ctx, Map.of("model_id", "llama3"));
        store.update(ctx, store.get(ctx, SERVICE_ID).withStatus(ServiceStatus.RUNNING));

        // when
        commands.start().execute(ctx, Map.of("service_id", SERVICE_ID));

        // then
        assertThat(store.get(ctx, SERVICE_ID).status()).isEqualTo(ServiceStatus.RUNNING);
        assertThat(provider.startCalls()).isEqualTo(1);
    }

    @Test
    void start_provider_실패시_failed_상태와_service_start_failed() {
        // given
        commands.create().execute(ctx, Map.of("model_id", "llama3"));
        provider.failStartWith(UnitException.of("service", ErrorCode.INTERNAL_ERROR, "no gpu available"));

        // when / then
        assertThatThrownBy(() -> commands.start().execute(ctx, Map.of("service_id", SERVICE_ID)))
            .hasMessage("start service " + SERVICE_ID + ": no gpu available")
            .satisfies(e -> assertThat(UnitException.hasCode(e, ErrorCode.SERVICE_START_FAILED)).isTrue());
        assertThat(store.get(ctx, SERVICE_ID).status()).isEqualTo(ServiceStatus.FAILED);
        assertThat(bus.eventsOfType(ServiceEvents.FAILED)).singleElement()
            .satisfies(event -> assertThat(event.payload())
                .containsEntry("status", "failed")
                .containsEntry("error", "no gpu available")
                .containsEntry("error_code", "internal_error"));
    }

    @Test
    void start_failed_상태에서_다시_시작_가능() {
        commands.create().execute(ctx, Map.of("model_id", "llama3"));
        provider.failStartWith(new IllegalStateException("boom"));
        assertThatThrownBy(() -> commands.start().execute(ctx, Map.of("service_id", SERVICE_ID)));

        provider.clearFailures();
        commands.start().execute(ctx, Map.of("service_id", SERVICE_ID));

        assertThat(store.get(ctx, SERVICE_ID).status()).isEqualTo(ServiceStatus.RUNNING);
    }

    @Test
    void start_timeout이_지나면_deadline_취소와_failed_상태() {
        // given
        commands.create().execute(ctx, Map.of("model_id", "llama3"));
        provider.setStartDelay(Duration.ofSeconds(10));

        // when / then
        assertThatThrownBy(() -> commands.start().execute(ctx, Map.of("service_id", SERVICE_ID, "timeout", 1)))
            .isInstanceOfSatisfying(ContextCancelledException.class,
                e -> assertThat(e.isDeadlineExceeded()).isTrue());
        assertThat(store.get(ctx, SERVICE_ID).status()).isEqualTo(ServiceStatus.FAILED);
    }

    @Test
    void start_timeout_범위_검사() {
        commands.create().execute(ctx, Map.of("model_id", "llama3"));

        assertThatThrownBy(() -> commands.start().execute(ctx, Map.of("service_id", SERVICE_ID, "timeout", 0)))
            .satisfies(e -> assertThat(UnitException.hasCode(e, ErrorCode.INVALID_INPUT)).isTrue());
        assertThat(provider.startCalls()).isZero();
    }

    // ==================== stop ====================

    @Test
    void stop_running에서_stopped로_전이() {
        // given
        commands.create().execute(ctx, Map.of("model_id", "llama3"));
        commands.start().execute(ctx, Map.of("service_id", SERVICE_ID));

        // when
        commands.stop().execute(ctx, Map.of("service_id", SERVICE_ID, "force", true));

        // then
        ModelService stored = store.get(ctx, SERVICE_ID);
        assertThat(stored.status()).isEqualTo(ServiceStatus.STOPPED);
        assertThat(stored.activeReplicas()).isZero();
        assertThat(provider.isRunning(ctx, SERVICE_ID)).isFalse();
        assertThat(bus.eventsOfType(ServiceEvents.STOPPED)).singleElement()
            .satisfies(event -> assertThat(event.payload()).containsEntry("reason", "forced"));
    }

    @Test
    void stop_이미_멈춘_서비스는_provider를_부르지_않음() {
        commands.create().execute(ctx, Map.of("model_id", "llama3"));
        commands.stop().execute(ctx, Map.of("service_id", SERVICE_ID));
        int callsAfterFirstStop = provider.stopCalls();

        Map<String, Object> output = commands.stop().execute(ctx, Map.of("service_id", SERVICE_ID));

        assertThat(output).containsEntry("success", true);
        assertThat(provider.stopCalls()).isEqualTo(callsAfterFirstStop);
        assertThat(bus.eventsOfType(ServiceEvents.STOPPED)).hasSize(1);
    }

    @Test
    void stop_실행_중이_아닌_서비스의_provider_오류는_무시() {
        commands.create().execute(ctx, Map.of("model_id", "llama3"));
        provider.failStopWith(new IllegalStateException("nothing to stop"));

        commands.stop().execute(ctx, Map.of("service_id", SERVICE_ID));

        assertThat(store.get(ctx, SERVICE_ID).status()).isEqualTo(ServiceStatus.STOPPED);
    }

    @Test
    void stop_실행_중_서비스의_provider_오류는_전파하고_상태_복구() {
        // given
        commands.create().execute(ctx, Map.of("model_id", "llama3"));
        commands.start().execute(ctx, Map.of("service_id", SERVICE_ID));
        provider.failStopWith(UnitException.of("service", ErrorCode.INTERNAL_ERROR, "container stuck"));

        // when / then
        assertThatThrownBy(() -> commands.stop().execute(ctx, Map.of("service_id", SERVICE_ID)))
            .hasMessage("stop service " + SERVICE_ID + ": container stuck");
        assertThat(store.get(ctx, SERVICE_ID).status()).isEqualTo(ServiceStatus.RUNNING);
    }

    // ==================== scale ====================

    @Test
    void scale_replicas_갱신과_scaled_발행() {
        // given
        commands.create().execute(ctx, Map.of("model_id", "llama3", "replicas", 2));
        commands.start().execute(ctx, Map.of("service_id", SERVICE_ID));

        // when
        commands.scale().execute(ctx, Map.of("service_id", SERVICE_ID, "replicas", 5));

        // then
        ModelService stored = store.get(ctx, SERVICE_ID);
        assertThat(stored.replicas()).isEqualTo(5);
        assertThat(stored.activeReplicas()).isEqualTo(5);
        assertThat(bus.eventsOfType(ServiceEvents.SCALED)).singleElement()
            .satisfies(event -> assertThat(event.payload())
                .containsEntry("old_replicas", 2)
                .containsEntry("new_replicas", 5));
    }

    @Test
    void scale_0은_허용_음수는_invalid_input() {
        commands.create().execute(ctx, Map.of("model_id", "llama3"));

        commands.scale().execute(ctx, Map.of("service_id", SERVICE_ID, "replicas", 0));
        assertThat(store.get(ctx, SERVICE_ID).replicas()).isZero();

        assertThatThrownBy(() -> commands.scale().execute(ctx, Map.of("service_id", SERVICE_ID, "replicas", -1)))
            .hasMessage("replicas must be a non-negative integer")
            .satisfies(e -> assertThat(UnitException.hasCode(e, ErrorCode.INVALID_INPUT)).isTrue());
    }

    @Test
    void scale_provider_실패는_service_scale_failed() {
        commands.create().execute(ctx, Map.of("model_id", "llama3"));
        provider.failScaleWith(new IllegalStateException("quota exceeded"));

        assertThatThrownBy(() -> commands.scale().execute(ctx, Map.of("service_id", SERVICE_ID, "replicas", 4)))
            .hasMessage("scale service " + SERVICE_ID + ": quota exceeded")
            .satisfies(e -> assertThat(UnitException.hasCode(e, ErrorCode.SERVICE_SCALE_FAILED)).isTrue());
        assertThat(store.get(ctx, SERVICE_ID).replicas()).isEqualTo(1);
    }

    @Test
    void all_다섯_개_Command() {
        assertThat(commands.all()).extracting(command -> command.descriptor().name())
            .containsExactly("service.create", "service.delete", "service.scale", "service.start", "service.stop");
    }
}
