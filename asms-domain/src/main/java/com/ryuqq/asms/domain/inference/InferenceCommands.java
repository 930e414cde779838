package com.ryuqq.asms.domain.inference;

import com.ryuqq.asms.core.context.CallContext;
import com.ryuqq.asms.core.contract.Command;
import com.ryuqq.asms.core.contract.Example;
import com.ryuqq.asms.core.contract.StreamChunk;
import com.ryuqq.asms.core.contract.StreamingCommand;
import com.ryuqq.asms.core.contract.UnitDescriptor;
import com.ryuqq.asms.core.contract.Units;
import com.ryuqq.asms.core.error.ErrorCode;
import com.ryuqq.asms.core.error.UnitException;
import com.ryuqq.asms.core.event.EventPublisher;
import com.ryuqq.asms.core.schema.Inputs;
import com.ryuqq.asms.core.schema.Schema;
import com.ryuqq.asms.domain.support.DomainEvents;
import com.ryuqq.asms.runtime.stream.StreamBridge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;

/**
 * 추론 도메인 Command 모음.
 *
 * <p><strong>제공 Command:</strong></p>
 * <ul>
 *   <li>{@code inference.chat}, {@code inference.complete} - 단건 실행과 스트리밍 실행 모두 지원</li>
 *   <li>{@code inference.embed}, {@code inference.transcribe}, {@code inference.synthesize}</li>
 *   <li>{@code inference.generate_image}, {@code inference.generate_video}</li>
 *   <li>{@code inference.rerank}, {@code inference.detect}</li>
 * </ul>
 *
 * <p>모든 Command는 model을 먼저 검증하고, 이어서 Command별 필수 필드를 검증합니다.
 * chat과 complete의 단건 실행은 {@code inference.request_*} 이벤트를 발행합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class InferenceCommands {

    private static final Logger log = LoggerFactory.getLogger(InferenceCommands.class);

    private static final Schema MODEL_FIELD = Schema.string().description("Model identifier").build();

    private static final Schema USAGE_SCHEMA = Schema.object()
        .property("prompt_tokens", Schema.number())
        .property("completion_tokens", Schema.number())
        .property("total_tokens", Schema.number())
        .build();

    static final UnitDescriptor CHAT = UnitDescriptor.of(
        "inference.chat",
        "Perform a chat completion with an AI model",
        Schema.object()
            .property("model", MODEL_FIELD)
            .property("messages", Schema.arrayOf(Schema.object()
                .property("role", Schema.string().enumValues(MessageRole.tokens()))
                .property("content", Schema.string())
                .required("role", "content"))
                .description("Conversation messages"))
            .property("temperature", Schema.number().min(0).max(2).description("Sampling temperature"))
            .property("max_tokens", Schema.number().min(1).description("Maximum tokens to generate"))
            .property("top_p", Schema.number().min(0).max(1))
            .property("top_k", Schema.number().min(1))
            .property("frequency_penalty", Schema.number().min(-2).max(2))
            .property("presence_penalty", Schema.number().min(-2).max(2))
            .property("stop", Schema.arrayOf(Schema.string()).description("Stop sequences"))
            .property("stream", Schema.bool().description("Stream the response"))
            .required("model", "messages")
            .build(),
        Schema.object()
            .property("content", Schema.string())
            .property("finish_reason", Schema.string())
            .property("usage", USAGE_SCHEMA)
            .property("model", Schema.string())
            .property("id", Schema.string())
            .build(),
        List.of(Example.of(
            Map.of("model", "llama3", "messages", List.of(Map.of("role", "user", "content", "Hello!"))),
            Map.of("content", "Hello! How can I help you today?", "finish_reason", "stop",
                "usage", Map.of("prompt_tokens", 10, "completion_tokens", 8, "total_tokens", 18)),
            "Simple chat completion"
        ))
    );

    static final UnitDescriptor COMPLETE = UnitDescriptor.of(
        "inference.complete",
        "Perform a text completion with an AI model",
        Schema.object()
            .property("model", MODEL_FIELD)
            .property("prompt", Schema.string().description("Text prompt"))
            .property("temperature", Schema.number().min(0).max(2))
            .property("max_tokens", Schema.number().min(1))
            .property("top_p", Schema.number().min(0).max(1))
            .property("stop", Schema.arrayOf(Schema.string()))
            .property("stream", Schema.bool())
            .required("model", "prompt")
            .build(),
        Schema.object()
            .property("text", Schema.string())
            .property("finish_reason", Schema.string())
            .property("usage", USAGE_SCHEMA)
            .build(),
        List.of(Example.of(
            Map.of("model", "llama3", "prompt", "The capital of France is"),
            Map.of("text", " Paris.", "finish_reason", "stop"),
            "Complete a sentence"
        ))
    );

    static final UnitDescriptor EMBED = UnitDescriptor.of(
        "inference.embed",
        "Generate text embeddings using an embedding model",
        // input은 텍스트 또는 텍스트 배열이므로 스키마에 선언하지 않고 핸들러에서 검증
        Schema.object()
            .property("model", MODEL_FIELD)
            .required("model")
            .build(),
        Schema.object()
            .property("embeddings", Schema.arrayOf(Schema.arrayOf(Schema.number())))
            .property("usage", USAGE_SCHEMA)
            .build(),
        List.of(Example.of(
            Map.of("model", "text-embedding-3-small", "input", "Hello world"),
            Map.of("embeddings", List.of(List.of(0.1, 0.2, 0.3)),
                "usage", Map.of("prompt_tokens", 2, "total_tokens", 2)),
            "Embed a single text"
        ))
    );

    static final UnitDescriptor TRANSCRIBE = UnitDescriptor.of(
        "inference.transcribe",
        "Transcribe audio to text using an ASR model",
        Schema.object()
            .property("model", MODEL_FIELD)
            .property("audio", Schema.string().description("Audio payload"))
            .property("language", Schema.string().description("Language hint"))
            .required("model", "audio")
            .build(),
        Schema.object()
            .property("text", Schema.string())
            .property("language", Schema.string())
            .property("duration", Schema.number())
            .property("segments", Schema.arrayOf(Schema.object()
                .property("id", Schema.number())
                .property("start", Schema.number())
                .property("end", Schema.number())
                .property("text", Schema.string())))
            .build(),
        List.of(Example.of(
            Map.of("model", "whisper-large-v3", "audio", "base64_audio_data", "language", "en"),
            Map.of("text", "Hello, this is a transcription.", "language", "en", "duration", 3.5),
            "Transcribe English audio"
        ))
    );

    static final UnitDescriptor SYNTHESIZE = UnitDescriptor.of(
        "inference.synthesize",
        "Synthesize speech from text using a TTS model",
        Schema.object()
            .property("model", MODEL_FIELD)
            .property("text", Schema.string().description("Text to speak"))
            .property("voice", Schema.string().description("Voice identifier"))
            .required("model", "text")
            .build(),
        Schema.object()
            .property("audio", Schema.string().description("Base64 encoded audio"))
            .property("format", Schema.string())
            .property("duration", Schema.number())
            .build(),
        List.of(Example.of(
            Map.of("model", "tts-1", "text", "Hello, world!", "voice", "alloy"),
            Map.of("audio", "base64_audio", "format", "wav", "duration", 1.5),
            "Synthesize speech"
        ))
    );

    static final UnitDescriptor GENERATE_IMAGE = UnitDescriptor.of(
        "inference.generate_image",
        "Generate images from text using a diffusion model",
        Schema.object()
            .property("model", MODEL_FIELD)
            .property("prompt", Schema.string())
            .property("size", Schema.string().description("Image size, e.g. 1024x1024"))
            .property("steps", Schema.number().min(1))
            .property("seed", Schema.number())
            .property("negative_prompt", Schema.string())
            .property("width", Schema.number().min(1))
            .property("height", Schema.number().min(1))
            .required("model", "prompt")
            .build(),
        Schema.object()
            .property("images", Schema.arrayOf(Schema.object()
                .property("base64", Schema.string())
                .property("url", Schema.string()))
                .description("Generated images"))
            .property("format", Schema.string())
            .build(),
        List.of(Example.of(
            Map.of("model", "dall-e-3", "prompt", "A cat sitting on a moon", "size", "1024x1024"),
            Map.of("images", List.of(Map.of("base64", "image_data")), "format", "png"),
            "Generate an image"
        ))
    );

    static final UnitDescriptor GENERATE_VIDEO = UnitDescriptor.of(
        "inference.generate_video",
        "Generate video from text prompt",
        Schema.object()
            .property("model", MODEL_FIELD)
            .property("prompt", Schema.string())
            .property("duration", Schema.number().min(0))
            .property("fps", Schema.number().min(1))
            .property("width", Schema.number().min(1))
            .property("height", Schema.number().min(1))
            .property("steps", Schema.number().min(1))
            .property("seed", Schema.number())
            .required("model", "prompt")
            .build(),
        Schema.object()
            .property("video", Schema.string().description("Base64 encoded video"))
            .property("format", Schema.string())
            .property("duration", Schema.number())
            .build(),
        List.of(Example.of(
            Map.of("model", "video-gen-1", "prompt", "A sunset over the ocean", "duration", 5),
            Map.of("video", "base64_video", "format", "mp4", "duration", 5.0),
            "Generate a short video"
        ))
    );

    static final UnitDescriptor RERANK = UnitDescriptor.of(
        "inference.rerank",
        "Rerank documents by relevance to a query",
        Schema.object()
            .property("model", MODEL_FIELD)
            .property("query", Schema.string())
            .property("documents", Schema.arrayOf(Schema.string()))
            .required("model", "query", "documents")
            .build(),
        Schema.object()
            .property("results", Schema.arrayOf(Schema.object()
                .property("document", Schema.string())
                .property("score", Schema.number())
                .property("index", Schema.number())))
            .build(),
        List.of(Example.of(
            Map.of("model", "rerank-1", "query", "What is machine learning?",
                "documents", List.of("Machine learning is AI.", "Dogs are pets.")),
            Map.of("results", List.of(
                Map.of("document", "Machine learning is AI.", "score", 0.95, "index", 0),
                Map.of("document", "Dogs are pets.", "score", 0.1, "index", 1))),
            "Rerank documents"
        ))
    );

    static final UnitDescriptor DETECT = UnitDescriptor.of(
        "inference.detect",
        "Detect objects in an image",
        Schema.object()
            .property("model", MODEL_FIELD)
            .property("image", Schema.string().description("Image payload"))
            .required("model", "image")
            .build(),
        Schema.object()
            .property("detections", Schema.arrayOf(Schema.object()
                .property("label", Schema.string())
                .property("confidence", Schema.number())
                .property("bbox", Schema.arrayOf(Schema.number())))
                .description("Detected objects"))
            .build(),
        List.of(Example.of(
            Map.of("model", "yolov8", "image", "base64_image_data"),
            Map.of("detections", List.of(Map.of("label", "person", "confidence", 0.95,
                "bbox", List.of(100.0, 100.0, 200.0, 300.0)))),
            "Detect objects in image"
        ))
    );

    private final InferenceProvider provider;
    private final StreamBridge streamBridge;
    private final EventPublisher publisher;
    private final Clock clock;

    /**
     * 생성자.
     *
     * @param provider 추론 provider (nullable, 없으면 실행 시 provider_not_set)
     * @param streamBridge 스트리밍 브리지
     * @param publisher 이벤트 publisher (nullable)
     * @param clock 시각 기준
     */
    public InferenceCommands(
        InferenceProvider provider,
        StreamBridge streamBridge,
        EventPublisher publisher,
        Clock clock
    ) {
        if (streamBridge == null) {
            throw new IllegalArgumentException("streamBridge cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.provider = provider;
        this.streamBridge = streamBridge;
        this.publisher = EventPublisher.orNoop(publisher);
        this.clock = clock;
    }

    public StreamingCommand chat() {
        return Units.streamingCommand(CHAT, this::handleChat, this::streamChat, publisher, clock);
    }

    public StreamingCommand complete() {
        return Units.streamingCommand(COMPLETE, this::handleComplete, this::streamComplete, publisher, clock);
    }

    public Command embed() {
        return Units.command(EMBED, this::handleEmbed, publisher, clock);
    }

    public Command transcribe() {
        return Units.command(TRANSCRIBE, this::handleTranscribe, publisher, clock);
    }

    public Command synthesize() {
        return Units.command(SYNTHESIZE, this::handleSynthesize, publisher, clock);
    }

    public Command generateImage() {
        return Units.command(GENERATE_IMAGE, this::handleGenerateImage, publisher, clock);
    }

    public Command generateVideo() {
        return Units.command(GENERATE_VIDEO, this::handleGenerateVideo, publisher, clock);
    }

    public Command rerank() {
        return Units.command(RERANK, this::handleRerank, publisher, clock);
    }

    public Command detect() {
        return Units.command(DETECT, this::handleDetect, publisher, clock);
    }

    public List<Command> all() {
        return List.of(chat(), complete(), embed(), transcribe(), synthesize(), generateImage(), generateVideo(),
            rerank(), detect());
    }

    // ========================================
    // chat / complete
    // ========================================

    private Map<String, Object> handleChat(CallContext ctx, Map<String, Object> input) {
        InferenceProvider p = requireProvider(provider);
        String model = InferenceInputs.model(input);
        List<Message> messages = InferenceInputs.messages(input);
        ChatOptions options = InferenceInputs.chatOptions(input);

        String requestId = startRequest(model, "chat");
        long startedAt = clock.millis();
        ChatResponse response;
        try {
            response = p.chat(ctx, model, messages, options);
        } catch (RuntimeException e) {
            throw failRequest(requestId, "chat failed", e);
        }
        completeRequest(requestId, startedAt, response.usage());
        return InferenceViews.chat(response);
    }

    private void streamChat(CallContext ctx, Map<String, Object> input, BlockingQueue<StreamChunk> outbound) {
        InferenceProvider p = requireProvider(provider);
        String model = InferenceInputs.model(input);
        List<Message> messages = InferenceInputs.messages(input);
        ChatOptions options = InferenceInputs.chatOptions(input);

        try {
            streamBridge.<ChatStreamChunk>bridge(
                ctx,
                (workerCtx, sink) -> p.chatStream(workerCtx, model, messages, options, sink),
                chunk -> StreamChunk.content(chunk.content(), InferenceViews.chunkMetadata(
                    chunk.finishReason(), chunk.model() != null ? chunk.model() : model, chunk.id())),
                outbound
            );
        } catch (UnitException e) {
            throw UnitException.wrap("chat stream failed", e);
        }
    }

    private Map<String, Object> handleComplete(CallContext ctx, Map<String, Object> input) {
        InferenceProvider p = requireProvider(provider);
        String model = InferenceInputs.model(input);
        String prompt = InferenceInputs.requireText(input, "prompt");
        CompleteOptions options = InferenceInputs.completeOptions(input);

        String requestId = startRequest(model, "complete");
        long startedAt = clock.millis();
        CompletionResponse response;
        try {
            response = p.complete(ctx, model, prompt, options);
        } catch (RuntimeException e) {
            throw failRequest(requestId, "completion failed", e);
        }
        completeRequest(requestId, startedAt, response.usage());
        return InferenceViews.completion(response);
    }

    private void streamComplete(CallContext ctx, Map<String, Object> input, BlockingQueue<StreamChunk> outbound) {
        InferenceProvider p = requireProvider(provider);
        String model = InferenceInputs.model(input);
        String prompt = InferenceInputs.requireText(input, "prompt");
        CompleteOptions options = InferenceInputs.completeOptions(input);

        try {
            streamBridge.<CompleteStreamChunk>bridge(
                ctx,
                (workerCtx, sink) -> p.completeStream(workerCtx, model, prompt, options, sink),
                chunk -> StreamChunk.content(chunk.text(), InferenceViews.chunkMetadata(
                    chunk.finishReason(), chunk.model() != null ? chunk.model() : model, chunk.id())),
                outbound
            );
        } catch (UnitException e) {
            throw UnitException.wrap("completion stream failed", e);
        }
    }

    // ========================================
    // other modalities
    // ========================================

    private Map<String, Object> handleEmbed(CallContext ctx, Map<String, Object> input) {
        InferenceProvider p = requireProvider(provider);
        String model = InferenceInputs.model(input);
        List<String> texts = InferenceInputs.embeddingInput(input);
        try {
            return InferenceViews.embeddings(p.embed(ctx, model, texts));
        } catch (UnitException e) {
            throw UnitException.wrap("embedding failed", e);
        }
    }

    private Map<String, Object> handleTranscribe(CallContext ctx, Map<String, Object> input) {
        InferenceProvider p = requireProvider(provider);
        String model = InferenceInputs.model(input);
        byte[] audio = InferenceInputs.requirePayload(input, "audio");
        String language = Inputs.string(input, "language");
        try {
            return InferenceViews.transcription(p.transcribe(ctx, model, audio, language));
        } catch (UnitException e) {
            throw UnitException.wrap("transcription failed", e);
        }
    }

    private Map<String, Object> handleSynthesize(CallContext ctx, Map<String, Object> input) {
        InferenceProvider p = requireProvider(provider);
        String model = InferenceInputs.model(input);
        String text = InferenceInputs.requireText(input, "text");
        String voice = Inputs.string(input, "voice");
        try {
            return InferenceViews.audio(p.synthesize(ctx, model, text, voice));
        } catch (UnitException e) {
            throw UnitException.wrap("synthesis failed", e);
        }
    }

    private Map<String, Object> handleGenerateImage(CallContext ctx, Map<String, Object> input) {
        InferenceProvider p = requireProvider(provider);
        String model = InferenceInputs.model(input);
        String prompt = InferenceInputs.requireText(input, "prompt");
        ImageOptions options = InferenceInputs.imageOptions(input);
        try {
            return InferenceViews.images(p.generateImage(ctx, model, prompt, options));
        } catch (UnitException e) {
            throw UnitException.wrap("image generation failed", e);
        }
    }

    private Map<String, Object> handleGenerateVideo(CallContext ctx, Map<String, Object> input) {
        InferenceProvider p = requireProvider(provider);
        String model = InferenceInputs.model(input);
        String prompt = InferenceInputs.requireText(input, "prompt");
        VideoOptions options = InferenceInputs.videoOptions(input);
        try {
            return InferenceViews.video(p.generateVideo(ctx, model, prompt, options));
        } catch (UnitException e) {
            throw UnitException.wrap("video generation failed", e);
        }
    }

    private Map<String, Object> handleRerank(CallContext ctx, Map<String, Object> input) {
        InferenceProvider p = requireProvider(provider);
        String model = InferenceInputs.model(input);
        String query = InferenceInputs.requireText(input, "query");
        List<String> documents = InferenceInputs.documents(input);
        try {
            return InferenceViews.rerank(p.rerank(ctx, model, query, documents));
        } catch (UnitException e) {
            throw UnitException.wrap("rerank failed", e);
        }
    }

    private Map<String, Object> handleDetect(CallContext ctx, Map<String, Object> input) {
        InferenceProvider p = requireProvider(provider);
        String model = InferenceInputs.model(input);
        byte[] image = InferenceInputs.requirePayload(input, "image");
        try {
            return InferenceViews.detections(p.detect(ctx, model, image));
        } catch (UnitException e) {
            throw UnitException.wrap("detection failed", e);
        }
    }

    // ========================================
    // request events
    // ========================================

    private String startRequest(String model, String requestType) {
        String requestId = UUID.randomUUID().toString();
        DomainEvents.publish(publisher, InferenceEvents.requestStarted(requestId, model, requestType, clock));
        return requestId;
    }

    private void completeRequest(String requestId, long startedAt, Usage usage) {
        long durationMs = Math.max(0, clock.millis() - startedAt);
        DomainEvents.publish(publisher,
            InferenceEvents.requestCompleted(requestId, durationMs, usage.totalTokens(), clock));
        log.debug("Inference request {} completed in {}ms", requestId, durationMs);
    }

    /**
     * 실패 이벤트를 발행하고 호출자가 던질 예외를 반환.
     *
     * <p>UnitException은 문맥 문구를 붙여 래핑하고, 그 외 예외(취소 포함)는 그대로 반환합니다.</p>
     */
    private RuntimeException failRequest(String requestId, String context, RuntimeException error) {
        DomainEvents.publish(publisher, InferenceEvents.requestFailed(requestId, error.getMessage(), clock));
        if (error instanceof UnitException unitException) {
            return UnitException.wrap(context, unitException);
        }
        return error;
    }

    static InferenceProvider requireProvider(InferenceProvider provider) {
        if (provider == null) {
            throw UnitException.of(InferenceEvents.DOMAIN, ErrorCode.PROVIDER_NOT_SET, "inference provider not set");
        }
        return provider;
    }
}
