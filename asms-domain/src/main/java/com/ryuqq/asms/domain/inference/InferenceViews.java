package com.ryuqq.asms.domain.inference;

import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 추론 값 객체를 Unit 출력 맵으로 변환.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class InferenceViews {

    // Utility class - prevent instantiation
    private InferenceViews() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    static Map<String, Object> usage(Usage usage) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("prompt_tokens", usage.promptTokens());
        view.put("completion_tokens", usage.completionTokens());
        view.put("total_tokens", usage.totalTokens());
        return view;
    }

    static Map<String, Object> chat(ChatResponse response) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("content", response.content());
        view.put("finish_reason", response.finishReason());
        view.put("usage", usage(response.usage()));
        view.put("model", response.model());
        view.put("id", response.id());
        return view;
    }

    static Map<String, Object> completion(CompletionResponse response) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("text", response.text());
        view.put("finish_reason", response.finishReason());
        view.put("usage", usage(response.usage()));
        return view;
    }

    static Map<String, Object> embeddings(EmbeddingResponse response) {
        Map<String, Object> usage = new LinkedHashMap<>();
        usage.put("prompt_tokens", response.usage().promptTokens());
        usage.put("total_tokens", response.usage().totalTokens());
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("embeddings", response.embeddings());
        view.put("usage", usage);
        return view;
    }

    static Map<String, Object> transcription(TranscriptionResponse response) {
        List<Map<String, Object>> segments = new ArrayList<>(response.segments().size());
        for (TranscriptionSegment segment : response.segments()) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("id", segment.id());
            item.put("start", segment.start());
            item.put("end", segment.end());
            item.put("text", segment.text());
            segments.add(item);
        }
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("text", response.text());
        view.put("language", response.language());
        view.put("duration", response.duration());
        view.put("segments", segments);
        return view;
    }

    static Map<String, Object> audio(AudioResponse response) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("audio", Base64.getEncoder().encodeToString(response.audio()));
        view.put("format", response.format());
        view.put("duration", response.duration());
        return view;
    }

    static Map<String, Object> images(ImageGenerationResponse response) {
        List<Map<String, Object>> images = new ArrayList<>(response.images().size());
        for (GeneratedImage image : response.images()) {
            Map<String, Object> item = new LinkedHashMap<>();
            if (image.base64() != null) {
                item.put("base64", image.base64());
            }
            if (image.url() != null) {
                item.put("url", image.url());
            }
            images.add(item);
        }
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("images", images);
        view.put("format", response.format());
        return view;
    }

    static Map<String, Object> video(VideoGenerationResponse response) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("video", Base64.getEncoder().encodeToString(response.video()));
        view.put("format", response.format());
        view.put("duration", response.duration());
        return view;
    }

    static Map<String, Object> rerank(RerankResponse response) {
        List<Map<String, Object>> results = new ArrayList<>(response.results().size());
        for (RerankResult result : response.results()) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("document", result.document());
            item.put("score", result.score());
            item.put("index", result.index());
            results.add(item);
        }
        return Map.of("results", results);
    }

    static Map<String, Object> detections(DetectionResponse response) {
        List<Map<String, Object>> detections = new ArrayList<>(response.detections().size());
        for (Detection detection : response.detections()) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("label", detection.label());
            item.put("confidence", detection.confidence());
            item.put("bbox", detection.bbox().toList());
            detections.add(item);
        }
        return Map.of("detections", detections);
    }

    static Map<String, Object> model(InferenceModel model) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", model.id());
        view.put("name", model.name());
        view.put("type", model.type().getValue());
        view.put("provider", model.provider());
        view.put("description", model.description());
        view.put("max_tokens", model.maxTokens());
        view.put("modalities", model.modalities());
        return view;
    }

    static Map<String, Object> models(List<InferenceModel> models) {
        List<Map<String, Object>> items = new ArrayList<>(models.size());
        for (InferenceModel model : models) {
            items.add(model(model));
        }
        return Map.of("models", items);
    }

    static Map<String, Object> voices(List<Voice> voices) {
        List<Map<String, Object>> items = new ArrayList<>(voices.size());
        for (Voice voice : voices) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("id", voice.id());
            item.put("name", voice.name());
            item.put("language", voice.language());
            item.put("gender", voice.gender());
            item.put("description", voice.description());
            items.add(item);
        }
        return Map.of("voices", items);
    }

    /**
     * 스트림 조각 메타데이터. 알려진 값만 담습니다.
     */
    static Map<String, Object> chunkMetadata(String finishReason, String model, String id) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (finishReason != null && !finishReason.isEmpty()) {
            metadata.put("finish_reason", finishReason);
        }
        if (model != null && !model.isEmpty()) {
            metadata.put("model", model);
        }
        if (id != null && !id.isEmpty()) {
            metadata.put("id", id);
        }
        return metadata;
    }
}
