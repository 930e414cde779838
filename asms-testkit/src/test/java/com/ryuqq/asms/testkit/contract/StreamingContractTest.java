package com.ryuqq.asms.testkit.contract;

import com.ryuqq.asms.core.context.CallContext;
import com.ryuqq.asms.core.context.ContextCancelledException;
import com.ryuqq.asms.core.contract.StreamChunk;
import com.ryuqq.asms.core.error.ErrorCode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 스트리밍 실행 계약 테스트.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>N개 조각을 보내는 provider는 정확히 N개의 content 프레임 후 반환</li>
 *   <li>50ms 후 취소하면 컨텍스트 예외로 반환하고 이후 프레임 없음</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class StreamingContractTest extends AbstractUnitContractTest {

    private static final Map<String, Object> CHAT_INPUT = Map.of(
        "model", "llama3",
        "messages", List.of(Map.of("role", "user", "content", "Hello!"))
    );

    private final ExecutorService executor = Executors.newSingleThreadExecutor();

    @AfterEach
    void stopExecutor() {
        executor.shutdownNow();
    }

    @Test
    void N개_조각_전달_후_반환() {
        // given
        inferenceProvider.setStreamTokens(List.of("a", "b", "c", "d"));
        BlockingQueue<StreamChunk> outbound = new ArrayBlockingQueue<>(16);

        // when
        dispatcher.executeStream(ctx, "inference.chat", CHAT_INPUT, outbound);

        // then
        List<StreamChunk> frames = new ArrayList<>(outbound);
        assertThat(frames).hasSize(4);
        assertThat(frames).extracting(StreamChunk::type).containsOnly(StreamChunk.TYPE_CONTENT);
        assertThat(frames).extracting(StreamChunk::data).containsExactly("a", "b", "c", "d");
    }

    @Test
    void 취소되면_컨텍스트_예외로_반환하고_전달_중단() throws Exception {
        // given
        inferenceProvider.setChunkDelay(Duration.ofMillis(20));
        List<String> tokens = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            tokens.add("t" + i);
        }
        inferenceProvider.setStreamTokens(tokens);
        BlockingQueue<StreamChunk> outbound = new ArrayBlockingQueue<>(200);
        CallContext streamCtx = CallContext.background().withCancel();

        // when
        Future<?> stream = executor.submit(
            () -> dispatcher.executeStream(streamCtx, "inference.chat", CHAT_INPUT, outbound));
        Thread.sleep(50);
        streamCtx.cancel();

        // then
        assertThatThrownBy(() -> stream.get(2, TimeUnit.SECONDS))
            .hasCauseInstanceOf(ContextCancelledException.class);
        int afterReturn = outbound.size();
        Thread.sleep(100);
        assertThat(outbound).hasSize(afterReturn);
        assertThat(afterReturn).isLessThan(tokens.size());
    }

    @Test
    void 스트리밍을_지원하지_않는_Unit은_invalid_input() {
        assertErrorCode(() -> dispatcher.executeStream(ctx, "inference.embed",
            Map.of("model", "text-embedding-3-small", "input", "hi"), new ArrayBlockingQueue<>(1)),
            ErrorCode.INVALID_INPUT);
    }
}
