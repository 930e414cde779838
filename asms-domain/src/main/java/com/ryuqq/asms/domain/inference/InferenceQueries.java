package com.ryuqq.asms.domain.inference;

import com.ryuqq.asms.core.context.CallContext;
import com.ryuqq.asms.core.contract.Example;
import com.ryuqq.asms.core.contract.Query;
import com.ryuqq.asms.core.contract.UnitDescriptor;
import com.ryuqq.asms.core.contract.Units;
import com.ryuqq.asms.core.error.UnitException;
import com.ryuqq.asms.core.event.EventPublisher;
import com.ryuqq.asms.core.schema.Inputs;
import com.ryuqq.asms.core.schema.Schema;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 추론 도메인 Query 모음.
 *
 * <p><strong>제공 Query:</strong></p>
 * <ul>
 *   <li>{@code inference.models} - 모델 목록 (type 필터)</li>
 *   <li>{@code inference.voices} - TTS 목소리 목록 (model 필터는 provider가 해석)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class InferenceQueries {

    static final Schema MODEL_SCHEMA = Schema.object()
        .property("id", Schema.string())
        .property("name", Schema.string())
        .property("type", Schema.string().enumValues(ModelType.tokens()))
        .property("provider", Schema.string())
        .property("description", Schema.string())
        .property("max_tokens", Schema.number())
        .property("modalities", Schema.arrayOf(Schema.string()))
        .build();

    static final Schema MODELS_OUTPUT = Schema.object()
        .property("models", Schema.arrayOf(MODEL_SCHEMA))
        .required("models")
        .build();

    static final UnitDescriptor MODELS = UnitDescriptor.of(
        "inference.models",
        "List available inference models",
        Schema.object()
            .property("type", Schema.string().enumValues(ModelType.tokens()).description("Filter by model type"))
            .build(),
        MODELS_OUTPUT,
        List.of(
            Example.of(Map.of(), Map.of("models", List.of(Map.of("id", "llama3", "name", "Llama 3", "type", "llm"))),
                "List all models"),
            Example.of(Map.of("type", "llm"),
                Map.of("models", List.of(Map.of("id", "llama3", "name", "Llama 3", "type", "llm"))),
                "List LLM models only")
        )
    );

    static final UnitDescriptor VOICES = UnitDescriptor.of(
        "inference.voices",
        "List available voices for text-to-speech",
        Schema.object()
            .property("model", Schema.string().description("TTS model to get voices for"))
            .build(),
        Schema.object()
            .property("voices", Schema.arrayOf(Schema.object()
                .property("id", Schema.string())
                .property("name", Schema.string())
                .property("language", Schema.string())
                .property("gender", Schema.string())
                .property("description", Schema.string())))
            .required("voices")
            .build(),
        List.of(Example.of(Map.of("model", "tts-1"),
            Map.of("voices", List.of(Map.of("id", "alloy", "name", "Alloy", "language", "en"))),
            "List voices for a TTS model"))
    );

    private final InferenceProvider provider;
    private final EventPublisher publisher;
    private final Clock clock;

    public InferenceQueries(InferenceProvider provider, EventPublisher publisher, Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.provider = provider;
        this.publisher = EventPublisher.orNoop(publisher);
        this.clock = clock;
    }

    public Query models() {
        return Units.query(MODELS, this::handleModels, publisher, clock);
    }

    public Query voices() {
        return Units.query(VOICES, this::handleVoices, publisher, clock);
    }

    public List<Query> all() {
        return List.of(models(), voices());
    }

    private Map<String, Object> handleModels(CallContext ctx, Map<String, Object> input) {
        InferenceProvider p = InferenceCommands.requireProvider(provider);
        ModelType type = parseType(input).orElse(null);
        try {
            return InferenceViews.models(p.listModels(ctx, type));
        } catch (UnitException e) {
            throw UnitException.wrap("list models", e);
        }
    }

    private Map<String, Object> handleVoices(CallContext ctx, Map<String, Object> input) {
        InferenceProvider p = InferenceCommands.requireProvider(provider);
        String model = Inputs.string(input, "model");
        try {
            return InferenceViews.voices(p.listVoices(ctx, model));
        } catch (UnitException e) {
            throw UnitException.wrap("list voices", e);
        }
    }

    /**
     * type 필터 해석.
     *
     * @return 지정되지 않았으면 empty
     * @throws UnitException 알 수 없는 종류인 경우 (invalid_input)
     */
    static Optional<ModelType> parseType(Map<String, Object> input) {
        Optional<String> raw = Inputs.nonEmptyString(input, "type");
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(ModelType.fromValue(raw.get())
            .orElseThrow(() -> InferenceInputs.invalid("invalid model type: " + raw.get())));
    }
}
