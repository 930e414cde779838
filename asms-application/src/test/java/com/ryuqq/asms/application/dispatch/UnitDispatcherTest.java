package com.ryuqq.asms.application.dispatch;

import com.ryuqq.asms.core.context.CallContext;
import com.ryuqq.asms.core.context.ContextCancelledException;
import com.ryuqq.asms.core.contract.Resource;
import com.ryuqq.asms.core.contract.ResourceFactory;
import com.ryuqq.asms.core.contract.ResourceWatch;
import com.ryuqq.asms.core.contract.StreamChunk;
import com.ryuqq.asms.core.contract.UnitDescriptor;
import com.ryuqq.asms.core.contract.Units;
import com.ryuqq.asms.core.error.ErrorCode;
import com.ryuqq.asms.core.error.ErrorResponse;
import com.ryuqq.asms.core.error.UnitException;
import com.ryuqq.asms.core.registry.UnitRegistry;
import com.ryuqq.asms.core.schema.Schema;
import com.ryuqq.asms.runtime.event.InMemoryEventBus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * UnitDispatcher 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class UnitDispatcherTest {

    private static final Schema ECHO_INPUT = Schema.object()
        .property("text", Schema.string().minLength(1))
        .required("text")
        .build();
    private static final Schema ECHO_OUTPUT = Schema.object()
        .property("echo", Schema.string())
        .required("echo")
        .build();

    @Mock
    private Resource resource;

    private final UnitRegistry registry = new UnitRegistry();
    private final InMemoryEventBus eventBus = new InMemoryEventBus();
    private final CallContext ctx = CallContext.background();
    private final AtomicReference<Object> lastInput = new AtomicReference<>();
    private UnitDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        registry.registerCommand(Units.command(
            UnitDescriptor.of("demo.echo", "Echo text", ECHO_INPUT, ECHO_OUTPUT, List.of()),
            (c, input) -> Map.of("echo", input.get("text")),
            eventBus,
            Clock.systemUTC()
        ));
        registry.registerQuery(Units.query(
            UnitDescriptor.of("demo.inspect", "Return received input size", Schema.object().build(),
                Schema.object().build(), List.of()),
            (c, input) -> {
                lastInput.set(input);
                return Map.of("size", input.size());
            }
        ));
        registry.registerCommand(Units.command(
            UnitDescriptor.of("demo.broken", "Returns output violating its schema", Schema.object().build(),
                ECHO_OUTPUT, List.of()),
            (c, input) -> Map.of("unexpected", true)
        ));
        registry.registerCommand(Units.streamingCommand(
            UnitDescriptor.of("demo.count", "Stream numbers", Schema.object().build(), Schema.object().build(),
                List.of()),
            (c, input) -> Map.of("count", 3),
            (c, input, outbound) -> {
                for (int i = 1; i <= 3; i++) {
                    c.throwIfDone();
                    outbound.add(StreamChunk.content(i, Map.of()));
                }
            }
        ));
        dispatcher = new UnitDispatcher(registry);
    }

    // ==================== execute ====================

    @Test
    void execute_Command_실행_결과_반환() {
        // when
        Map<String, Object> output = dispatcher.execute(ctx, "demo.echo", Map.of("text", "hello"));

        // then
        assertThat(output).containsEntry("echo", "hello");
        assertThat(eventBus.eventsOfType("execution_started")).hasSize(1);
        assertThat(eventBus.eventsOfType("execution_completed")).hasSize(1);
    }

    @Test
    void execute_Query_실행_및_null_입력은_빈_객체로_취급() {
        // when
        Map<String, Object> output = dispatcher.execute(ctx, "demo.inspect", null);

        // then
        assertThat(output).containsEntry("size", 0);
        assertThat(lastInput.get()).isEqualTo(Map.of());
    }

    @Test
    void execute_등록되지_않은_이름은_unit_not_found() {
        assertThatThrownBy(() -> dispatcher.execute(ctx, "demo.missing", Map.of()))
            .satisfies(e -> assertThat(UnitException.hasCode(e, ErrorCode.UNIT_NOT_FOUND)).isTrue());
    }

    @Test
    void execute_입력_검증_실패시_Unit을_실행하지_않음() {
        // when & then
        assertThatThrownBy(() -> dispatcher.execute(ctx, "demo.echo", Map.of("text", "")))
            .satisfies(e -> assertThat(UnitException.hasCode(e, ErrorCode.INVALID_INPUT)).isTrue());
        assertThat(eventBus.events()).isEmpty();
    }

    @Test
    void execute_입력_검증을_끄면_핸들러가_그대로_받음() {
        // given
        UnitDispatcher lenient = new UnitDispatcher(registry, new DispatchConfig().withValidateInput(false));

        // when
        Map<String, Object> output = lenient.execute(ctx, "demo.inspect", Map.of("a", 1, "b", 2));

        // then
        assertThat(output).containsEntry("size", 2);
    }

    @Test
    void execute_출력_검증_기본값은_꺼짐() {
        Map<String, Object> output = dispatcher.execute(ctx, "demo.broken", Map.of());

        assertThat(output).containsEntry("unexpected", true);
    }

    @Test
    void execute_출력_검증_실패는_validation_failed() {
        // given
        UnitDispatcher strict = new UnitDispatcher(registry, new DispatchConfig().withValidateOutput(true));

        // when & then
        assertThatThrownBy(() -> strict.execute(ctx, "demo.broken", Map.of()))
            .isInstanceOf(UnitException.class)
            .satisfies(e -> {
                assertThat(((UnitException) e).getCode()).isEqualTo(ErrorCode.VALIDATION_FAILED);
                assertThat(e.getMessage()).contains("demo.broken");
            });
    }

    @Test
    void execute_취소된_컨텍스트는_그대로_전파() {
        // given
        CallContext cancelled = ctx.withCancel();
        cancelled.cancel();
        registry.registerCommand(Units.command(
            UnitDescriptor.of("demo.wait", "Checks cancellation", Schema.object().build(), Schema.object().build(),
                List.of()),
            (c, input) -> {
                c.throwIfDone();
                return Map.of();
            }
        ));

        // when & then
        assertThatThrownBy(() -> dispatcher.execute(cancelled, "demo.wait", Map.of()))
            .isInstanceOf(ContextCancelledException.class);
    }

    // ==================== executeStream ====================

    @Test
    void executeStream_조각을_순서대로_전달() {
        // given
        BlockingQueue<StreamChunk> outbound = new ArrayBlockingQueue<>(10);

        // when
        dispatcher.executeStream(ctx, "demo.count", Map.of(), outbound);

        // then
        List<StreamChunk> chunks = new ArrayList<>();
        outbound.drainTo(chunks);
        assertThat(chunks).extracting(StreamChunk::data).containsExactly(1, 2, 3);
    }

    @Test
    void executeStream_스트리밍_미지원_Unit은_invalid_input() {
        assertThatThrownBy(() -> dispatcher.executeStream(ctx, "demo.echo", Map.of("text", "x"),
            new ArrayBlockingQueue<>(1)))
            .satisfies(e -> assertThat(UnitException.hasCode(e, ErrorCode.INVALID_INPUT)).isTrue());
        assertThatThrownBy(() -> dispatcher.executeStream(ctx, "demo.inspect", Map.of(),
            new ArrayBlockingQueue<>(1)))
            .satisfies(e -> assertThat(UnitException.hasCode(e, ErrorCode.INVALID_INPUT)).isTrue());
    }

    @Test
    void executeStream_등록되지_않은_이름은_unit_not_found() {
        assertThatThrownBy(() -> dispatcher.executeStream(ctx, "demo.missing", Map.of(),
            new ArrayBlockingQueue<>(1)))
            .satisfies(e -> assertThat(UnitException.hasCode(e, ErrorCode.UNIT_NOT_FOUND)).isTrue());
    }

    // ==================== resources ====================

    @Test
    void read_정적_Resource_스냅샷() {
        // given
        when(resource.uri()).thenReturn("asms://demo");
        when(resource.get(ctx)).thenReturn(Map.of("ok", true));
        registry.registerResource(resource);

        // when
        Object snapshot = dispatcher.read(ctx, "asms://demo");

        // then
        assertThat(snapshot).isEqualTo(Map.of("ok", true));
    }

    @Test
    void watch_팩토리로_해석된_Resource_구독() {
        // given
        ResourceWatch watch = mock(ResourceWatch.class);
        ResourceFactory factory = mock(ResourceFactory.class);
        when(factory.pattern()).thenReturn("asms://demo/*");
        when(factory.canCreate("asms://demo/1")).thenReturn(true);
        when(factory.create("asms://demo/1")).thenReturn(resource);
        when(resource.watch(ctx)).thenReturn(watch);
        registry.registerFactory(factory);

        // when
        ResourceWatch result = dispatcher.watch(ctx, "asms://demo/1");

        // then
        assertThat(result).isSameAs(watch);
        verify(resource, never()).get(ctx);
    }

    @Test
    void read_해석할_수_없는_URI는_not_found() {
        assertThatThrownBy(() -> dispatcher.read(ctx, "asms://unknown"))
            .satisfies(e -> assertThat(UnitException.hasCode(e, ErrorCode.NOT_FOUND)).isTrue());
    }

    // ==================== catalog ====================

    @Test
    void catalog_이름순_정렬_및_스트리밍_표시() {
        // given
        when(resource.uri()).thenReturn("asms://demo");
        when(resource.domain()).thenReturn("demo");
        registry.registerResource(resource);

        // when
        List<CatalogEntry> catalog = dispatcher.catalog();

        // then
        assertThat(catalog).extracting(CatalogEntry::name)
            .containsExactly("asms://demo", "demo.broken", "demo.count", "demo.echo", "demo.inspect");
        assertThat(catalog).filteredOn(CatalogEntry::streaming)
            .extracting(CatalogEntry::name)
            .containsExactly("demo.count");
        assertThat(catalog.get(0).type()).isEqualTo(CatalogEntry.Type.RESOURCE);
        assertThat(catalog.get(4).type()).isEqualTo(CatalogEntry.Type.QUERY);
    }

    // ==================== toErrorResponse ====================

    @Test
    void toErrorResponse_코드와_상태_매핑() {
        // given
        UnitException notFound = UnitException.wrap("get rule r1",
            UnitException.of("alert", ErrorCode.ALERT_RULE_NOT_FOUND, "rule not found: r1"));

        // when
        ErrorResponse response = dispatcher.toErrorResponse(notFound);
        ErrorResponse internal = dispatcher.toErrorResponse(new IllegalStateException("boom"));

        // then
        assertThat(response.code()).isEqualTo("alert_rule_not_found");
        assertThat(response.domain()).isEqualTo("alert");
        assertThat(response.httpStatus()).isEqualTo(404);
        assertThat(response.message()).isEqualTo("get rule r1: rule not found: r1");
        assertThat(internal.code()).isEqualTo("internal_error");
        assertThat(internal.httpStatus()).isEqualTo(500);
    }
}
