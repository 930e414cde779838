package com.ryuqq.asms.domain.inference;

import com.ryuqq.asms.core.error.ErrorCode;
import com.ryuqq.asms.core.error.UnitException;
import com.ryuqq.asms.core.schema.Inputs;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.OptionalLong;

/**
 * 추론 Command 입력 해석.
 *
 * <p>필수 필드가 없으면 invalid_input으로 실패합니다. 옵션 값은 숫자 변환을 시도하고,
 * 변환할 수 없으면 provider 기본값(null)으로 둡니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class InferenceInputs {

    // Utility class - prevent instantiation
    private InferenceInputs() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    static String model(Map<String, Object> input) {
        return Inputs.nonEmptyString(input, "model")
            .orElseThrow(() -> invalid("model not specified"));
    }

    static String requireText(Map<String, Object> input, String key) {
        return Inputs.nonEmptyString(input, key)
            .orElseThrow(() -> invalid(key + " is required"));
    }

    static byte[] requirePayload(Map<String, Object> input, String key) {
        return requireText(input, key).getBytes(StandardCharsets.UTF_8);
    }

    /**
     * 대화 메시지 목록 해석.
     *
     * @throws UnitException 목록이 없거나 비었거나, 원소의 role/content가 텍스트가 아니거나,
     *                       role이 system/user/assistant가 아닌 경우 (invalid_input)
     */
    static List<Message> messages(Map<String, Object> input) {
        List<Object> raw = Inputs.list(input, "messages").orElse(List.of());
        if (raw.isEmpty()) {
            throw invalid("messages are required");
        }
        List<Message> messages = new ArrayList<>(raw.size());
        for (int i = 0; i < raw.size(); i++) {
            if (!(raw.get(i) instanceof Map<?, ?> item)) {
                throw invalid("messages[" + i + "] must be an object");
            }
            if (!(item.get("role") instanceof String roleText)) {
                throw invalid("messages[" + i + "].role must be text");
            }
            if (!(item.get("content") instanceof String content)) {
                throw invalid("messages[" + i + "].content must be text");
            }
            MessageRole role = MessageRole.fromValue(roleText)
                .orElseThrow(() -> invalid("invalid role: " + roleText));
            messages.add(new Message(role, content));
        }
        return messages;
    }

    /**
     * 임베딩 입력 해석. 단일 텍스트 또는 텍스트 목록.
     */
    static List<String> embeddingInput(Map<String, Object> input) {
        Object value = input.get("input");
        if (value instanceof String text) {
            if (text.isEmpty()) {
                throw invalid("input is required");
            }
            return List.of(text);
        }
        Optional<List<String>> texts = Inputs.strictTextList(input, "input");
        if (texts.isEmpty() || texts.get().isEmpty()) {
            throw invalid("input must be text or a non-empty array of text");
        }
        return texts.get();
    }

    static List<String> documents(Map<String, Object> input) {
        List<String> documents = Inputs.strictTextList(input, "documents").orElse(List.of());
        if (documents.isEmpty()) {
            throw invalid("documents are required");
        }
        return documents;
    }

    static ChatOptions chatOptions(Map<String, Object> input) {
        return new ChatOptions(
            decimal(input, "temperature"),
            integer(input, "max_tokens"),
            decimal(input, "top_p"),
            integer(input, "top_k"),
            decimal(input, "frequency_penalty"),
            decimal(input, "presence_penalty"),
            Inputs.textList(input, "stop").orElse(List.of())
        );
    }

    static CompleteOptions completeOptions(Map<String, Object> input) {
        return new CompleteOptions(
            decimal(input, "temperature"),
            integer(input, "max_tokens"),
            decimal(input, "top_p"),
            Inputs.textList(input, "stop").orElse(List.of())
        );
    }

    static ImageOptions imageOptions(Map<String, Object> input) {
        return new ImageOptions(
            Inputs.nonEmptyString(input, "size").orElse(null),
            integer(input, "steps"),
            longInteger(input, "seed"),
            Inputs.nonEmptyString(input, "negative_prompt").orElse(null),
            integer(input, "width"),
            integer(input, "height")
        );
    }

    static VideoOptions videoOptions(Map<String, Object> input) {
        return new VideoOptions(
            decimal(input, "duration"),
            integer(input, "fps"),
            integer(input, "width"),
            integer(input, "height"),
            integer(input, "steps"),
            longInteger(input, "seed")
        );
    }

    private static Double decimal(Map<String, Object> input, String key) {
        OptionalDouble value = Inputs.number(input, key);
        return value.isPresent() ? value.getAsDouble() : null;
    }

    private static Integer integer(Map<String, Object> input, String key) {
        OptionalInt value = Inputs.integer(input, key);
        return value.isPresent() ? value.getAsInt() : null;
    }

    private static Long longInteger(Map<String, Object> input, String key) {
        OptionalLong value = Inputs.longInteger(input, key);
        return value.isPresent() ? value.getAsLong() : null;
    }

    static UnitException invalid(String message) {
        return UnitException.of(InferenceEvents.DOMAIN, ErrorCode.INVALID_INPUT, message);
    }
}
