package com.ryuqq.asms.core.schema;

import com.ryuqq.asms.core.error.ErrorCode;
import com.ryuqq.asms.core.error.UnitException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.OptionalLong;

/**
 * 동적 입력 맵 읽기 헬퍼.
 *
 * <p>Unit 핸들러는 검증된 입력 맵을 이 메서드들로 좁혀서 사용합니다. 타입이 맞지 않는 값은
 * 없는 값과 동일하게 취급됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Inputs {

    // Utility class - prevent instantiation
    private Inputs() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 동적 입력을 키/값 맵으로 좁힘.
     *
     * @param input 입력 (null이면 빈 맵)
     * @return 입력 맵
     * @throws UnitException input이 맵이 아니거나 키가 문자열이 아닌 경우 (invalid_input)
     */
    public static Map<String, Object> asMap(Object input) {
        if (input == null) {
            return Map.of();
        }
        if (!(input instanceof Map<?, ?> map)) {
            throw UnitException.of(ErrorCode.INVALID_INPUT, "invalid input type: expected object, got " + typeName(input));
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (!(entry.getKey() instanceof String key)) {
                throw UnitException.of(ErrorCode.INVALID_INPUT, "invalid input type: object keys must be text");
            }
            copy.put(key, entry.getValue());
        }
        return Collections.unmodifiableMap(copy);
    }

    /**
     * 문자열 값 조회.
     *
     * @return 문자열이면 그 값, 아니면 빈 문자열
     */
    public static String string(Map<String, Object> input, String key) {
        Object value = input.get(key);
        return value instanceof String text ? text : "";
    }

    /**
     * 비어 있지 않은 문자열 값 조회.
     */
    public static Optional<String> nonEmptyString(Map<String, Object> input, String key) {
        String value = string(input, key);
        return value.isEmpty() ? Optional.empty() : Optional.of(value);
    }

    /**
     * 필수 문자열 값 조회.
     *
     * @throws UnitException 값이 없거나 비어 있는 경우 (invalid_input)
     */
    public static String requireString(Map<String, Object> input, String key) {
        return nonEmptyString(input, key)
            .orElseThrow(() -> UnitException.of(ErrorCode.INVALID_INPUT, key + " is required"));
    }

    public static Optional<Boolean> bool(Map<String, Object> input, String key) {
        Object value = input.get(key);
        return value instanceof Boolean flag ? Optional.of(flag) : Optional.empty();
    }

    /**
     * 실수 값 조회.
     *
     * @throws UnitException NaN 또는 무한대인 경우 (invalid_input)
     */
    public static OptionalDouble number(Map<String, Object> input, String key) {
        try {
            return Numbers.toDouble(input.get(key));
        } catch (ArithmeticException e) {
            throw outOfRange(key, e);
        }
    }

    /**
     * 정수 값 조회.
     *
     * @throws UnitException int 범위를 벗어난 경우 (invalid_input)
     */
    public static OptionalInt integer(Map<String, Object> input, String key) {
        try {
            return Numbers.toInt(input.get(key));
        } catch (ArithmeticException e) {
            throw outOfRange(key, e);
        }
    }

    public static OptionalLong longInteger(Map<String, Object> input, String key) {
        try {
            return Numbers.toLong(input.get(key));
        } catch (ArithmeticException e) {
            throw outOfRange(key, e);
        }
    }

    /**
     * 리스트 값 조회 (List 또는 배열).
     *
     * @return 리스트이면 그 원소들, 아니면 empty
     */
    public static Optional<List<Object>> list(Map<String, Object> input, String key) {
        return asList(input.get(key));
    }

    /**
     * 텍스트 리스트 조회.
     *
     * <p>문자열 리스트와 이질적인 리스트를 모두 받으며, 문자열이 아닌 원소는 텍스트로 변환합니다.
     * null 원소는 건너뜁니다.</p>
     */
    public static Optional<List<String>> textList(Map<String, Object> input, String key) {
        return list(input, key).map(items -> {
            List<String> texts = new ArrayList<>(items.size());
            for (Object item : items) {
                if (item != null) {
                    texts.add(item instanceof String text ? text : String.valueOf(item));
                }
            }
            return texts;
        });
    }

    /**
     * 엄격한 텍스트 리스트 조회.
     *
     * @throws UnitException 문자열이 아닌 원소가 있는 경우 (invalid_input)
     */
    public static Optional<List<String>> strictTextList(Map<String, Object> input, String key) {
        return list(input, key).map(items -> {
            List<String> texts = new ArrayList<>(items.size());
            for (int i = 0; i < items.size(); i++) {
                if (!(items.get(i) instanceof String text)) {
                    throw UnitException.of(ErrorCode.INVALID_INPUT, key + "[" + i + "] must be text");
                }
                texts.add(text);
            }
            return texts;
        });
    }

    /**
     * 동적 값을 리스트로 좁힘.
     *
     * @param value List, 객체 배열 또는 원시 배열
     * @return 리스트, 해당하지 않으면 empty
     */
    public static Optional<List<Object>> asList(Object value) {
        if (value instanceof List<?> list) {
            return Optional.of(new ArrayList<>(list));
        }
        if (value != null && value.getClass().isArray()) {
            return Optional.of(ArrayElements.of(value));
        }
        return Optional.empty();
    }

    private static UnitException outOfRange(String key, ArithmeticException cause) {
        return new UnitException(ErrorCode.INVALID_INPUT, null, "invalid " + key + ": " + cause.getMessage(), null, cause);
    }

    static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
