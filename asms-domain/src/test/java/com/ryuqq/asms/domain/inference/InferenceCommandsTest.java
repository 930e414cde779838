package com.ryuqq.asms.domain.inference;

import com.ryuqq.asms.core.context.CallContext;
import com.ryuqq.asms.core.context.ContextCancelledException;
import com.ryuqq.asms.core.contract.Command;
import com.ryuqq.asms.core.error.ErrorCode;
import com.ryuqq.asms.core.error.UnitException;
import com.ryuqq.asms.core.event.Event;
import com.ryuqq.asms.runtime.event.InMemoryEventBus;
import com.ryuqq.asms.runtime.stream.StreamBridge;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Base64;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * InferenceCommands 단건 실행 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class InferenceCommandsTest {

    private static final List<Map<String, Object>> HELLO = List.of(Map.of("role", "user", "content", "Hello!"));

    private final Clock clock = Clock.systemUTC();
    private final MockInferenceProvider provider = new MockInferenceProvider();
    private final InMemoryEventBus bus = new InMemoryEventBus();
    private final StreamBridge bridge = new StreamBridge();
    private final InferenceCommands commands = new InferenceCommands(provider, bridge, bus, clock);
    private final CallContext ctx = CallContext.background();

    @AfterEach
    void tearDown() {
        bridge.shutdown();
    }

    // ==================== chat ====================

    @Test
    @SuppressWarnings("unchecked")
    void chat_응답과_usage를_반환() {
        // when
        Map<String, Object> output = commands.chat().execute(ctx, Map.of("model", "llama3", "messages", HELLO));

        // then
        assertThat(output)
            .containsEntry("content", MockInferenceProvider.CHAT_CONTENT)
            .containsEntry("finish_reason", "stop")
            .containsEntry("model", "llama3");
        assertThat((String) output.get("id")).startsWith("chatcmpl-");
        Map<String, Object> usage = (Map<String, Object>) output.get("usage");
        assertThat(usage).containsEntry("prompt_tokens", 1).containsEntry("completion_tokens", 50)
            .containsEntry("total_tokens", 51);
    }

    @Test
    void chat_요청_이벤트는_같은_request_id로_묶임() {
        // when
        commands.chat().execute(ctx, Map.of("model", "llama3", "messages", HELLO));

        // then
        List<Event> started = bus.eventsOfType(InferenceEvents.REQUEST_STARTED);
        List<Event> completed = bus.eventsOfType(InferenceEvents.REQUEST_COMPLETED);
        assertThat(started).hasSize(1);
        assertThat(completed).hasSize(1);
        assertThat(started.get(0).payload())
            .containsEntry("model", "llama3")
            .containsEntry("type", "chat");
        assertThat(completed.get(0).payload())
            .containsEntry("request_id", started.get(0).payload().get("request_id"))
            .containsEntry("total_tokens", 51);
        assertThat(bus.eventsOfType(InferenceEvents.REQUEST_FAILED)).isEmpty();
    }

    @Test
    void chat_provider_오류는_코드_유지하며_래핑되고_failed_이벤트() {
        // given
        provider.failWith(UnitException.of("inference", ErrorCode.INFERENCE_MODEL_NOT_LOADED, "model not loaded"));

        // when & then
        assertThatThrownBy(() -> commands.chat().execute(ctx, Map.of("model", "llama3", "messages", HELLO)))
            .isInstanceOf(UnitException.class)
            .hasMessage("chat failed: model not loaded")
            .satisfies(e -> assertThat(UnitException.hasCode(e, ErrorCode.INFERENCE_MODEL_NOT_LOADED)).isTrue());
        assertThat(bus.eventsOfType(InferenceEvents.REQUEST_FAILED)).hasSize(1);
        assertThat(bus.eventsOfType(InferenceEvents.REQUEST_FAILED).get(0).payload())
            .containsEntry("error", "model not loaded");
    }

    @Test
    void chat_취소된_컨텍스트는_그대로_전파() {
        CallContext cancelled = CallContext.background().withCancel();
        cancelled.cancel();

        assertThatThrownBy(() -> commands.chat().execute(cancelled, Map.of("model", "llama3", "messages", HELLO)))
            .isSameAs(cancelled.err())
            .isInstanceOf(ContextCancelledException.class);
    }

    @Test
    void chat_옵션은_숫자_변환_후_provider로_전달() {
        // when
        commands.chat().execute(ctx, Map.of("model", "llama3", "messages", HELLO,
            "temperature", 1, "max_tokens", 256.0, "top_k", 40L, "stop", List.of("\n")));

        // then
        ChatOptions options = provider.lastChatOptions();
        assertThat(options.temperature()).isEqualTo(1.0);
        assertThat(options.maxTokens()).isEqualTo(256);
        assertThat(options.topK()).isEqualTo(40);
        assertThat(options.topP()).isNull();
        assertThat(options.stop()).containsExactly("\n");
    }

    // ==================== validation ====================

    @Test
    void model이_없으면_invalid_input() {
        assertThatThrownBy(() -> commands.chat().execute(ctx, Map.of("messages", HELLO)))
            .satisfies(e -> assertThat(UnitException.hasCode(e, ErrorCode.INVALID_INPUT)).isTrue())
            .hasMessageContaining("model");
        assertThat(bus.eventsOfType(InferenceEvents.REQUEST_STARTED)).isEmpty();
    }

    @Test
    void messages가_비어있으면_invalid_input() {
        assertThatThrownBy(() -> commands.chat().execute(ctx, Map.of("model", "llama3", "messages", List.of())))
            .satisfies(e -> assertThat(UnitException.hasCode(e, ErrorCode.INVALID_INPUT)).isTrue())
            .hasMessageContaining("messages");
    }

    @Test
    void message_role이_텍스트가_아니면_invalid_input() {
        List<Map<String, Object>> messages = List.of(Map.of("role", 1, "content", "hi"));

        assertThatThrownBy(() -> commands.chat().execute(ctx, Map.of("model", "llama3", "messages", messages)))
            .satisfies(e -> assertThat(UnitException.hasCode(e, ErrorCode.INVALID_INPUT)).isTrue())
            .hasMessageContaining("messages[0].role");
    }

    @Test
    void message_role이_알_수_없으면_invalid_input() {
        List<Map<String, Object>> messages = List.of(Map.of("role", "robot", "content", "hi"));

        assertThatThrownBy(() -> commands.chat().execute(ctx, Map.of("model", "llama3", "messages", messages)))
            .satisfies(e -> assertThat(UnitException.hasCode(e, ErrorCode.INVALID_INPUT)).isTrue())
            .hasMessageContaining("robot");
    }

    @ParameterizedTest
    @ValueSource(strings = {"complete", "synthesize", "generate_image", "generate_video", "transcribe", "detect",
        "rerank", "embed"})
    void 필수_필드가_없으면_invalid_input(String unit) {
        assertThatThrownBy(() -> commandNamed(unit).execute(ctx, Map.of("model", "m")))
            .satisfies(e -> assertThat(UnitException.hasCode(e, ErrorCode.INVALID_INPUT)).isTrue());
    }

    @Test
    void provider가_없으면_provider_not_set() {
        InferenceCommands withoutProvider = new InferenceCommands(null, bridge, bus, clock);

        assertThatThrownBy(() -> withoutProvider.embed().execute(ctx, Map.of("model", "m", "input", "x")))
            .satisfies(e -> assertThat(UnitException.hasCode(e, ErrorCode.PROVIDER_NOT_SET)).isTrue());
    }

    // ==================== other modalities ====================

    @Test
    void complete_텍스트_반환() {
        Map<String, Object> output = commands.complete().execute(ctx,
            Map.of("model", "llama3", "prompt", "The capital of France is"));

        assertThat(output)
            .containsEntry("text", MockInferenceProvider.COMPLETION_TEXT)
            .containsEntry("finish_reason", "stop");
        assertThat(bus.eventsOfType(InferenceEvents.REQUEST_STARTED).get(0).payload()).containsEntry("type", "complete");
    }

    @Test
    @SuppressWarnings("unchecked")
    void embed_단일_텍스트와_목록_모두_허용() {
        Map<String, Object> single = commands.embed().execute(ctx, Map.of("model", "e", "input", "Hello world"));
        Map<String, Object> many = commands.embed().execute(ctx, Map.of("model", "e", "input", List.of("a", "b")));

        List<List<Double>> singleVectors = (List<List<Double>>) single.get("embeddings");
        assertThat(singleVectors).hasSize(1);
        assertThat(singleVectors.get(0)).hasSize(MockInferenceProvider.EMBEDDING_DIMENSIONS);
        assertThat((List<?>) many.get("embeddings")).hasSize(2);
    }

    @Test
    void embed_텍스트가_아닌_원소는_invalid_input() {
        assertThatThrownBy(() -> commands.embed().execute(ctx, Map.of("model", "e", "input", List.of("a", 2))))
            .satisfies(e -> assertThat(UnitException.hasCode(e, ErrorCode.INVALID_INPUT)).isTrue());
    }

    @Test
    @SuppressWarnings("unchecked")
    void transcribe_구간과_기본_언어() {
        Map<String, Object> output = commands.transcribe().execute(ctx, Map.of("model", "whisper", "audio", "abc"));

        assertThat(output)
            .containsEntry("text", MockInferenceProvider.TRANSCRIPTION_TEXT)
            .containsEntry("language", "en");
        assertThat((List<Map<String, Object>>) output.get("segments"))
            .extracting(s -> s.get("text"))
            .containsExactly("This is a mock transcription", "of the audio.");
    }

    @Test
    void synthesize_오디오는_base64() {
        Map<String, Object> output = commands.synthesize().execute(ctx, Map.of("model", "tts-1", "text", "Hello"));

        assertThat(output).containsEntry("format", "wav");
        assertThat((Double) output.get("duration")).isCloseTo(0.25, within(1e-9));
        byte[] audio = Base64.getDecoder().decode((String) output.get("audio"));
        assertThat(audio).hasSize(4000);
    }

    @Test
    @SuppressWarnings("unchecked")
    void generate_image_옵션_전달과_이미지_목록() {
        Map<String, Object> output = commands.generateImage().execute(ctx,
            Map.of("model", "dall-e-3", "prompt", "cat", "size", "1024x1024", "seed", 42));

        assertThat(provider.lastImageOptions().size()).isEqualTo("1024x1024");
        assertThat(provider.lastImageOptions().seed()).isEqualTo(42L);
        assertThat((List<Map<String, Object>>) output.get("images"))
            .containsExactly(Map.of("base64", "mock_base64_image_data"));
        assertThat(output).containsEntry("format", "png");
    }

    @Test
    void generate_video_duration_기본값() {
        Map<String, Object> output = commands.generateVideo().execute(ctx, Map.of("model", "v", "prompt", "sunset"));

        assertThat(output).containsEntry("format", "mp4").containsEntry("duration", 5.0);
        assertThat(new String(Base64.getDecoder().decode((String) output.get("video")), StandardCharsets.UTF_8))
            .isEqualTo("mock_video_data");
    }

    @Test
    @SuppressWarnings("unchecked")
    void rerank_입력_순서대로_점수_감소() {
        Map<String, Object> output = commands.rerank().execute(ctx,
            Map.of("model", "r", "query", "q", "documents", List.of("a", "b", "c")));

        List<Map<String, Object>> results = (List<Map<String, Object>>) output.get("results");
        assertThat(results).extracting(r -> r.get("index")).containsExactly(0, 1, 2);
        assertThat((Double) results.get(0).get("score")).isGreaterThan((Double) results.get(2).get("score"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void detect_bbox는_네_개의_숫자() {
        Map<String, Object> output = commands.detect().execute(ctx, Map.of("model", "yolov8", "image", "img"));

        List<Map<String, Object>> detections = (List<Map<String, Object>>) output.get("detections");
        assertThat(detections).hasSize(2);
        assertThat(detections.get(0))
            .containsEntry("label", "person")
            .containsEntry("bbox", List.of(100.0, 100.0, 200.0, 300.0));
    }

    @Test
    void all은_아홉_개의_Command() {
        assertThat(commands.all()).extracting(c -> c.name()).containsExactly(
            "inference.chat", "inference.complete", "inference.embed", "inference.transcribe",
            "inference.synthesize", "inference.generate_image", "inference.generate_video", "inference.rerank",
            "inference.detect");
        assertThat(commands.chat().supportsStreaming()).isTrue();
        assertThat(commands.embed().supportsStreaming()).isFalse();
    }

    private Command commandNamed(String verb) {
        return commands.all().stream()
            .filter(c -> c.name().equals("inference." + verb))
            .findFirst()
            .orElseThrow();
    }
}
