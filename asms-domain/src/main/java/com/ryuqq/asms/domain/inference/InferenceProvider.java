package com.ryuqq.asms.domain.inference;

import com.ryuqq.asms.core.context.CallContext;
import com.ryuqq.asms.runtime.stream.StreamSink;

import java.util.List;

/**
 * 추론 엔진 어댑터.
 *
 * <p>구현체는 실패를 {@link com.ryuqq.asms.core.error.UnitException}으로 표현합니다
 * (inference_model_not_loaded, inference_timeout, inference_rate_limited, inference_engine_error).
 * 컨텍스트가 종료되면 {@code ctx.err()}를 던집니다.</p>
 *
 * <p><strong>스트리밍:</strong> {@link #chatStream}과 {@link #completeStream}은 조각을 sink로
 * 밀어 넣고 스트림이 끝나면 반환합니다. sink는 버퍼가 가득 차면 블로킹합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface InferenceProvider {

    ChatResponse chat(CallContext ctx, String model, List<Message> messages, ChatOptions options);

    void chatStream(
        CallContext ctx,
        String model,
        List<Message> messages,
        ChatOptions options,
        StreamSink<ChatStreamChunk> sink
    );

    CompletionResponse complete(CallContext ctx, String model, String prompt, CompleteOptions options);

    void completeStream(
        CallContext ctx,
        String model,
        String prompt,
        CompleteOptions options,
        StreamSink<CompleteStreamChunk> sink
    );

    EmbeddingResponse embed(CallContext ctx, String model, List<String> input);

    /**
     * 음성 인식.
     *
     * @param language 언어 힌트 (빈 문자열이면 자동)
     */
    TranscriptionResponse transcribe(CallContext ctx, String model, byte[] audio, String language);

    /**
     * 음성 합성.
     *
     * @param voice 목소리 ID (빈 문자열이면 기본값)
     */
    AudioResponse synthesize(CallContext ctx, String model, String text, String voice);

    ImageGenerationResponse generateImage(CallContext ctx, String model, String prompt, ImageOptions options);

    VideoGenerationResponse generateVideo(CallContext ctx, String model, String prompt, VideoOptions options);

    RerankResponse rerank(CallContext ctx, String model, String query, List<String> documents);

    DetectionResponse detect(CallContext ctx, String model, byte[] image);

    /**
     * 모델 목록.
     *
     * @param type 종류 필터 (null이면 전체)
     */
    List<InferenceModel> listModels(CallContext ctx, ModelType type);

    /**
     * 목소리 목록.
     *
     * @param model TTS 모델 (빈 문자열이면 전체)
     */
    List<Voice> listVoices(CallContext ctx, String model);
}
