package com.ryuqq.asms.core.contract;

import com.ryuqq.asms.core.context.CallContext;
import com.ryuqq.asms.core.event.EventPublisher;
import com.ryuqq.asms.core.event.ExecutionContext;
import com.ryuqq.asms.core.schema.Inputs;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.BlockingQueue;

/**
 * 핸들러 기반 Unit 팩토리.
 *
 * <p>생성된 Unit은 실행마다 {@link ExecutionContext}를 만들어 Started를 먼저 발행하고,
 * 핸들러 결과에 따라 Completed 또는 Failed를 정확히 하나 발행합니다.
 * 입력이 맵이 아닌 경우에도 Started/Failed가 발행됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Command create = Units.command(descriptor, (ctx, in) -&gt; Map.of("rule_id", store.create(ctx, rule)),
 *     publisher, clock);
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Units {

    // Utility class - prevent instantiation
    private Units() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static Command command(UnitDescriptor descriptor, UnitHandler handler) {
        return command(descriptor, handler, null, Clock.systemUTC());
    }

    public static Command command(UnitDescriptor descriptor, UnitHandler handler, EventPublisher publisher, Clock clock) {
        return new HandlerCommand(descriptor, handler, publisher, clock);
    }

    public static Query query(UnitDescriptor descriptor, UnitHandler handler) {
        return query(descriptor, handler, null, Clock.systemUTC());
    }

    public static Query query(UnitDescriptor descriptor, UnitHandler handler, EventPublisher publisher, Clock clock) {
        return new HandlerQuery(descriptor, handler, publisher, clock);
    }

    public static StreamingCommand streamingCommand(
        UnitDescriptor descriptor,
        UnitHandler handler,
        StreamHandler streamHandler
    ) {
        return streamingCommand(descriptor, handler, streamHandler, null, Clock.systemUTC());
    }

    /**
     * 스트리밍 Command 생성.
     *
     * @param descriptor 메타데이터
     * @param handler 단건 실행 핸들러
     * @param streamHandler 스트리밍 실행 핸들러
     * @param publisher 이벤트 publisher (nullable)
     * @param clock 시각 기준
     * @return StreamingCommand
     */
    public static StreamingCommand streamingCommand(
        UnitDescriptor descriptor,
        UnitHandler handler,
        StreamHandler streamHandler,
        EventPublisher publisher,
        Clock clock
    ) {
        return new HandlerStreamingCommand(descriptor, handler, streamHandler, publisher, clock);
    }

    private abstract static class HandlerUnit implements Unit {

        private final UnitDescriptor descriptor;
        private final UnitHandler handler;
        protected final EventPublisher publisher;
        protected final Clock clock;

        HandlerUnit(UnitDescriptor descriptor, UnitHandler handler, EventPublisher publisher, Clock clock) {
            if (descriptor == null) {
                throw new IllegalArgumentException("descriptor cannot be null");
            }
            if (handler == null) {
                throw new IllegalArgumentException("handler cannot be null");
            }
            if (clock == null) {
                throw new IllegalArgumentException("clock cannot be null");
            }
            this.descriptor = descriptor;
            this.handler = handler;
            this.publisher = EventPublisher.orNoop(publisher);
            this.clock = clock;
        }

        @Override
        public UnitDescriptor descriptor() {
            return descriptor;
        }

        @Override
        public Map<String, Object> execute(CallContext ctx, Object input) {
            ExecutionContext execution = new ExecutionContext(publisher, domain(), name(), clock);
            execution.publishStarted(input);
            try {
                Map<String, Object> result = handler.handle(ctx, Inputs.asMap(input));
                Map<String, Object> output = result != null ? result : Map.of();
                execution.publishCompleted(output);
                return output;
            } catch (RuntimeException | Error e) {
                execution.publishFailed(e);
                throw e;
            }
        }

        @Override
        public String toString() {
            return getClass().getSimpleName() + "[" + name() + "]";
        }
    }

    private static final class HandlerCommand extends HandlerUnit implements Command {

        HandlerCommand(UnitDescriptor descriptor, UnitHandler handler, EventPublisher publisher, Clock clock) {
            super(descriptor, handler, publisher, clock);
        }
    }

    private static final class HandlerQuery extends HandlerUnit implements Query {

        HandlerQuery(UnitDescriptor descriptor, UnitHandler handler, EventPublisher publisher, Clock clock) {
            super(descriptor, handler, publisher, clock);
        }
    }

    private static final class HandlerStreamingCommand extends HandlerUnit implements StreamingCommand {

        private final StreamHandler streamHandler;

        HandlerStreamingCommand(
            UnitDescriptor descriptor,
            UnitHandler handler,
            StreamHandler streamHandler,
            EventPublisher publisher,
            Clock clock
        ) {
            super(descriptor, handler, publisher, clock);
            if (streamHandler == null) {
                throw new IllegalArgumentException("streamHandler cannot be null");
            }
            this.streamHandler = streamHandler;
        }

        @Override
        public void executeStream(CallContext ctx, Object input, BlockingQueue<StreamChunk> outbound) {
            if (outbound == null) {
                throw new IllegalArgumentException("outbound cannot be null");
            }
            ExecutionContext execution = new ExecutionContext(publisher, domain(), name(), clock);
            execution.publishStarted(input);
            try {
                streamHandler.handle(ctx, Inputs.asMap(input), outbound);
                execution.publishCompleted(Map.of("streamed", true));
            } catch (RuntimeException | Error e) {
                execution.publishFailed(e);
                throw e;
            }
        }
    }
}
