package com.ryuqq.asms.domain.inference;

import com.ryuqq.asms.core.context.CallContext;
import com.ryuqq.asms.core.error.ErrorCode;
import com.ryuqq.asms.core.error.UnitException;
import com.ryuqq.asms.runtime.stream.StreamSink;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 고정 응답을 반환하는 InferenceProvider.
 *
 * <p><strong>조절 가능한 동작:</strong></p>
 * <ul>
 *   <li>{@link #failWith(RuntimeException)} - 모든 호출이 해당 예외로 실패</li>
 *   <li>{@link #setStreamTokens(List)} - 스트림으로 보낼 조각</li>
 *   <li>{@link #setChunkDelay(Duration)} - 조각 사이 지연 (취소 시 즉시 중단)</li>
 *   <li>{@link #failStreamWith(RuntimeException)} - 모든 조각을 보낸 뒤 던질 예외</li>
 *   <li>{@link #addModel(InferenceModel)}, {@link #removeModel(String)} - 모델 목록 변경</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class MockInferenceProvider implements InferenceProvider {

    public static final String CHAT_CONTENT = "This is a mock response from the AI model.";
    public static final String COMPLETION_TEXT = "This is a mock completion response.";
    public static final String TRANSCRIPTION_TEXT = "This is a mock transcription of the audio.";
    public static final int EMBEDDING_DIMENSIONS = 1536;
    public static final String FINISH_STOP = "stop";

    private static final List<String> DEFAULT_STREAM_TOKENS =
        List.of("This ", "is ", "a ", "mock ", "response ", "from ", "the ", "AI ", "model.");

    private final List<InferenceModel> models = new CopyOnWriteArrayList<>(defaultModels());
    private final List<Voice> voices = new CopyOnWriteArrayList<>(defaultVoices());
    private final AtomicReference<ChatOptions> lastChatOptions = new AtomicReference<>();
    private final AtomicReference<ImageOptions> lastImageOptions = new AtomicReference<>();
    private volatile List<String> streamTokens = DEFAULT_STREAM_TOKENS;
    private volatile long chunkDelayMs;
    private volatile RuntimeException failure;
    private volatile RuntimeException streamFailure;

    public void failWith(RuntimeException error) {
        this.failure = error;
    }

    public void clearFailure() {
        this.failure = null;
        this.streamFailure = null;
    }

    public void failStreamWith(RuntimeException error) {
        this.streamFailure = error;
    }

    public void setStreamTokens(List<String> tokens) {
        this.streamTokens = List.copyOf(tokens);
    }

    public void setChunkDelay(Duration delay) {
        this.chunkDelayMs = delay.toMillis();
    }

    public void addModel(InferenceModel model) {
        models.removeIf(existing -> existing.id().equals(model.id()));
        models.add(model);
    }

    public void removeModel(String modelId) {
        models.removeIf(model -> model.id().equals(modelId));
    }

    /**
     * 마지막 chat/chatStream 호출에 전달된 옵션.
     */
    public ChatOptions lastChatOptions() {
        return lastChatOptions.get();
    }

    public ImageOptions lastImageOptions() {
        return lastImageOptions.get();
    }

    @Override
    public ChatResponse chat(CallContext ctx, String model, List<Message> messages, ChatOptions options) {
        check(ctx);
        lastChatOptions.set(options);
        return new ChatResponse(CHAT_CONTENT, FINISH_STOP, Usage.of(promptTokens(messages), 50), model,
            newId("chatcmpl-"));
    }

    @Override
    public void chatStream(
        CallContext ctx,
        String model,
        List<Message> messages,
        ChatOptions options,
        StreamSink<ChatStreamChunk> sink
    ) {
        check(ctx);
        lastChatOptions.set(options);
        String id = newId("chatcmpl-");
        List<String> tokens = streamTokens;
        Usage usage = Usage.of(promptTokens(messages), tokens.size());
        for (int i = 0; i < tokens.size(); i++) {
            pause(ctx);
            boolean last = i == tokens.size() - 1;
            sink.send(new ChatStreamChunk(id, model, tokens.get(i), last ? FINISH_STOP : null, last ? usage : null));
        }
        throwStreamFailure();
    }

    @Override
    public CompletionResponse complete(CallContext ctx, String model, String prompt, CompleteOptions options) {
        check(ctx);
        return new CompletionResponse(COMPLETION_TEXT, FINISH_STOP, Usage.of(prompt.length() / 4, 30));
    }

    @Override
    public void completeStream(
        CallContext ctx,
        String model,
        String prompt,
        CompleteOptions options,
        StreamSink<CompleteStreamChunk> sink
    ) {
        check(ctx);
        String id = newId("cmpl-");
        List<String> tokens = streamTokens;
        Usage usage = Usage.of(prompt.length() / 4, tokens.size());
        for (int i = 0; i < tokens.size(); i++) {
            pause(ctx);
            boolean last = i == tokens.size() - 1;
            sink.send(new CompleteStreamChunk(id, model, tokens.get(i), last ? FINISH_STOP : null, last ? usage : null));
        }
        throwStreamFailure();
    }

    @Override
    public EmbeddingResponse embed(CallContext ctx, String model, List<String> input) {
        check(ctx);
        List<List<Double>> embeddings = new ArrayList<>(input.size());
        int tokens = 0;
        for (String text : input) {
            embeddings.add(Collections.nCopies(EMBEDDING_DIMENSIONS, 0.1));
            tokens += text.length() / 4;
        }
        return new EmbeddingResponse(embeddings, new Usage(tokens, 0, tokens));
    }

    @Override
    public TranscriptionResponse transcribe(CallContext ctx, String model, byte[] audio, String language) {
        check(ctx);
        String resolved = language == null || language.isEmpty() ? "en" : language;
        return new TranscriptionResponse(
            TRANSCRIPTION_TEXT,
            List.of(
                new TranscriptionSegment(0, 0.0, 2.5, "This is a mock transcription"),
                new TranscriptionSegment(1, 2.5, 5.0, "of the audio.")
            ),
            resolved,
            audio.length / 16000.0
        );
    }

    @Override
    public AudioResponse synthesize(CallContext ctx, String model, String text, String voice) {
        check(ctx);
        double duration = text.length() * 0.05;
        return new AudioResponse(new byte[(int) (duration * 16000)], "wav", duration);
    }

    @Override
    public ImageGenerationResponse generateImage(CallContext ctx, String model, String prompt, ImageOptions options) {
        check(ctx);
        lastImageOptions.set(options);
        return new ImageGenerationResponse(List.of(GeneratedImage.ofBase64("mock_base64_image_data")), "png");
    }

    @Override
    public VideoGenerationResponse generateVideo(CallContext ctx, String model, String prompt, VideoOptions options) {
        check(ctx);
        double duration = options.duration() != null ? options.duration() : 5.0;
        return new VideoGenerationResponse("mock_video_data".getBytes(StandardCharsets.UTF_8), "mp4", duration);
    }

    @Override
    public RerankResponse rerank(CallContext ctx, String model, String query, List<String> documents) {
        check(ctx);
        List<RerankResult> results = new ArrayList<>(documents.size());
        for (int i = 0; i < documents.size(); i++) {
            results.add(new RerankResult(documents.get(i), 1.0 - i * 0.1, i));
        }
        return new RerankResponse(results, Usage.EMPTY);
    }

    @Override
    public DetectionResponse detect(CallContext ctx, String model, byte[] image) {
        check(ctx);
        return new DetectionResponse(List.of(
            new Detection("person", 0.95, new BBox(100, 100, 200, 300)),
            new Detection("car", 0.87, new BBox(350, 200, 150, 100))
        ), model);
    }

    @Override
    public List<InferenceModel> listModels(CallContext ctx, ModelType type) {
        check(ctx);
        if (type == null) {
            return List.copyOf(models);
        }
        List<InferenceModel> filtered = new ArrayList<>();
        for (InferenceModel model : models) {
            if (model.type() == type) {
                filtered.add(model);
            }
        }
        return filtered;
    }

    @Override
    public List<Voice> listVoices(CallContext ctx, String model) {
        check(ctx);
        return List.copyOf(voices);
    }

    private void check(CallContext ctx) {
        ctx.throwIfDone();
        RuntimeException error = failure;
        if (error != null) {
            throw error;
        }
    }

    private void throwStreamFailure() {
        RuntimeException error = streamFailure;
        if (error != null) {
            throw error;
        }
    }

    private void pause(CallContext ctx) {
        long delay = chunkDelayMs;
        if (delay <= 0) {
            ctx.throwIfDone();
            return;
        }
        try {
            if (ctx.awaitDone(delay, TimeUnit.MILLISECONDS)) {
                throw ctx.err();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UnitException(ErrorCode.INFERENCE_ENGINE_ERROR, InferenceEvents.DOMAIN,
                "mock stream interrupted", null, e);
        }
    }

    private static int promptTokens(List<Message> messages) {
        int tokens = 0;
        for (Message message : messages) {
            tokens += message.content().length() / 4;
        }
        return tokens;
    }

    private static String newId(String prefix) {
        return prefix + UUID.randomUUID().toString().substring(0, 8);
    }

    private static List<InferenceModel> defaultModels() {
        return List.of(
            InferenceModel.of("llama3", "Llama 3", ModelType.LLM, "ollama", 8192),
            InferenceModel.of("gpt-4", "GPT-4", ModelType.LLM, "openai", 8192),
            InferenceModel.of("whisper-large-v3", "Whisper Large V3", ModelType.ASR, "ollama", 0),
            InferenceModel.of("tts-1", "TTS 1", ModelType.TTS, "openai", 0),
            InferenceModel.of("text-embedding-3-small", "Text Embedding 3 Small", ModelType.EMBEDDING, "openai", 0),
            InferenceModel.of("dall-e-3", "DALL-E 3", ModelType.DIFFUSION, "openai", 0),
            InferenceModel.of("stable-diffusion-xl", "Stable Diffusion XL", ModelType.DIFFUSION, "local", 0)
        );
    }

    private static List<Voice> defaultVoices() {
        return List.of(
            new Voice("alloy", "Alloy", "en", "", "Neutral and balanced"),
            new Voice("echo", "Echo", "en", "male", "Warm and conversational"),
            new Voice("fable", "Fable", "en", "neutral", "British accent"),
            new Voice("onyx", "Onyx", "en", "male", "Deep and authoritative"),
            new Voice("nova", "Nova", "en", "female", "Energetic and friendly"),
            new Voice("shimmer", "Shimmer", "en", "female", "Soft and gentle")
        );
    }
}
