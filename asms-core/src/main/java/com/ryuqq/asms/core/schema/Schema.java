package com.ryuqq.asms.core.schema;

import com.ryuqq.asms.core.error.ErrorCode;
import com.ryuqq.asms.core.error.UnitException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 선언적 스키마 트리 및 동적 입력 검증기.
 *
 * <p>Unit의 입력/출력과 Resource 데이터의 형태를 기술합니다. 생성 후 불변이며 검증은
 * 스키마를 변경하지 않습니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>type=array 스키마는 반드시 items를 가짐</li>
 *   <li>type=object 스키마의 required는 properties 키의 부분집합</li>
 * </ul>
 *
 * <p><strong>검증 순서:</strong></p>
 * <ol>
 *   <li>null은 모든 타입에서 실패</li>
 *   <li>object: 맵이 아니면 실패 → required 키 존재 확인 → 선언된 프로퍼티 재귀 검증 (알 수 없는 키 무시)</li>
 *   <li>array: List 또는 배열이 아니면 실패 → 각 원소를 items로 검증</li>
 *   <li>string/number/boolean 타입 확인 (number는 모든 정수/실수 허용)</li>
 *   <li>enum 일치 확인</li>
 *   <li>min/max, minLength/maxLength, pattern(전체 일치) 확인</li>
 * </ol>
 *
 * <p>실패는 {@link ErrorCode#INVALID_INPUT} 코드의 {@link UnitException}이며 가능한 경우
 * details의 "path"에 실패 위치가 담깁니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Schema input = Schema.object()
 *     .property("name", Schema.string().minLength(1))
 *     .property("severity", Schema.string().enumValues("info", "warning", "critical"))
 *     .required("name", "severity")
 *     .build();
 *
 * input.validate(Map.of("name", "High CPU", "severity", "warning"));
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Schema {

    private final SchemaType type;
    private final Map<String, Field> properties;
    private final List<String> required;
    private final Schema items;
    private final List<Object> enumValues;
    private final Double min;
    private final Double max;
    private final Integer minLength;
    private final Integer maxLength;
    private final Pattern pattern;
    private final String title;
    private final String description;
    private final boolean optional;
    private final Object defaultValue;
    private final List<Object> examples;

    private Schema(Builder builder) {
        this.type = builder.type;
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(builder.properties));
        this.required = List.copyOf(builder.required);
        this.items = builder.items;
        this.enumValues = Collections.unmodifiableList(new ArrayList<>(builder.enumValues));
        this.min = builder.min;
        this.max = builder.max;
        this.minLength = builder.minLength;
        this.maxLength = builder.maxLength;
        this.pattern = builder.pattern;
        this.title = builder.title;
        this.description = builder.description;
        this.optional = builder.optional;
        this.defaultValue = builder.defaultValue;
        this.examples = Collections.unmodifiableList(new ArrayList<>(builder.examples));
    }

    public static Builder builder(SchemaType type) {
        return new Builder(type);
    }

    public static Builder object() {
        return new Builder(SchemaType.OBJECT);
    }

    public static Builder string() {
        return new Builder(SchemaType.STRING);
    }

    public static Builder number() {
        return new Builder(SchemaType.NUMBER);
    }

    public static Builder bool() {
        return new Builder(SchemaType.BOOLEAN);
    }

    public static Builder arrayOf(Schema items) {
        return new Builder(SchemaType.ARRAY).items(items);
    }

    public static Builder arrayOf(Builder items) {
        return arrayOf(items.build());
    }

    /**
     * 값 검증.
     *
     * @param value 검증할 동적 값
     * @throws UnitException 검증 실패 시 (invalid_input)
     */
    public void validate(Object value) {
        check(value, "");
    }

    /**
     * 값이 유효한지 확인.
     *
     * @param value 검증할 동적 값
     * @return 유효하면 true
     */
    public boolean isValid(Object value) {
        try {
            validate(value);
            return true;
        } catch (UnitException e) {
            return false;
        }
    }

    private void check(Object value, String path) {
        if (value == null) {
            throw failure(path, path.isEmpty() ? "input is null" : "value is null");
        }
        switch (type) {
            case OBJECT -> checkObject(value, path);
            case ARRAY -> checkArray(value, path);
            case STRING -> checkString(value, path);
            case NUMBER -> checkNumber(value, path);
            case BOOLEAN -> checkBoolean(value, path);
        }
    }

    private void checkObject(Object value, String path) {
        if (!(value instanceof Map<?, ?> map)) {
            throw failure(path, "expected object, got " + Inputs.typeName(value));
        }
        for (String name : required) {
            if (!map.containsKey(name)) {
                throw failure(path, "required field \"" + name + "\" is missing");
            }
        }
        for (Field field : properties.values()) {
            if (map.containsKey(field.name())) {
                field.schema().check(map.get(field.name()), join(path, field.name()));
            }
        }
    }

    private void checkArray(Object value, String path) {
        List<Object> elements = Inputs.asList(value)
            .orElseThrow(() -> failure(path, "expected array, got " + Inputs.typeName(value)));
        for (int i = 0; i < elements.size(); i++) {
            items.check(elements.get(i), path + "[" + i + "]");
        }
    }

    private void checkString(Object value, String path) {
        if (!(value instanceof String text)) {
            throw failure(path, "expected string, got " + Inputs.typeName(value));
        }
        checkEnum(value, path);
        int length = text.codePointCount(0, text.length());
        if (minLength != null && length < minLength) {
            throw failure(path, "string length " + length + " is less than minimum " + minLength);
        }
        if (maxLength != null && length > maxLength) {
            throw failure(path, "string length " + length + " exceeds maximum " + maxLength);
        }
        if (pattern != null && !pattern.matcher(text).matches()) {
            throw failure(path, "string \"" + text + "\" does not match pattern \"" + pattern.pattern() + "\"");
        }
    }

    private void checkNumber(Object value, String path) {
        if (!Numbers.isNumeric(value)) {
            throw failure(path, "expected number, got " + Inputs.typeName(value));
        }
        if (!Numbers.isFinite(value)) {
            throw failure(path, "value " + value + " is not a finite number");
        }
        checkEnum(value, path);
        double number = ((Number) value).doubleValue();
        if (min != null && number < min) {
            throw failure(path, "value " + value + " is less than minimum " + formatBound(min));
        }
        if (max != null && number > max) {
            throw failure(path, "value " + value + " exceeds maximum " + formatBound(max));
        }
    }

    private void checkBoolean(Object value, String path) {
        if (!(value instanceof Boolean)) {
            throw failure(path, "expected boolean, got " + Inputs.typeName(value));
        }
        checkEnum(value, path);
    }

    private void checkEnum(Object value, String path) {
        if (enumValues.isEmpty()) {
            return;
        }
        for (Object allowed : enumValues) {
            if (Objects.equals(allowed, value)) {
                return;
            }
        }
        throw failure(path, "value " + value + " is not one of allowed values " + enumValues);
    }

    private static UnitException failure(String path, String reason) {
        String message = path.isEmpty() ? reason : "field \"" + path + "\": " + reason;
        Map<String, Object> details = path.isEmpty() ? Map.of() : Map.of("path", path);
        return new UnitException(ErrorCode.INVALID_INPUT, null, message, details, null);
    }

    private static String join(String path, String name) {
        return path.isEmpty() ? name : path + "." + name;
    }

    private static String formatBound(double bound) {
        return bound == Math.rint(bound) && !Double.isInfinite(bound)
            ? String.valueOf((long) bound)
            : String.valueOf(bound);
    }

    /**
     * 스키마를 동적 맵으로 기술 (카탈로그 노출용).
     *
     * @return type, properties, required, items, enum, 범위, 설명 등을 담은 맵
     */
    public Map<String, Object> describe() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("type", type.getValue());
        if (title != null) {
            result.put("title", title);
        }
        if (description != null) {
            result.put("description", description);
        }
        if (!properties.isEmpty()) {
            Map<String, Object> props = new LinkedHashMap<>();
            properties.forEach((name, field) -> props.put(name, field.schema().describe()));
            result.put("properties", props);
        }
        if (!required.isEmpty()) {
            result.put("required", required);
        }
        if (items != null) {
            result.put("items", items.describe());
        }
        if (!enumValues.isEmpty()) {
            result.put("enum", enumValues);
        }
        if (min != null) {
            result.put("minimum", min);
        }
        if (max != null) {
            result.put("maximum", max);
        }
        if (minLength != null) {
            result.put("minLength", minLength);
        }
        if (maxLength != null) {
            result.put("maxLength", maxLength);
        }
        if (pattern != null) {
            result.put("pattern", pattern.pattern());
        }
        if (defaultValue != null) {
            result.put("default", defaultValue);
        }
        if (optional) {
            result.put("optional", true);
        }
        if (!examples.isEmpty()) {
            result.put("examples", examples);
        }
        return result;
    }

    public SchemaType getType() {
        return type;
    }

    public Map<String, Field> getProperties() {
        return properties;
    }

    public Optional<Field> getProperty(String name) {
        return Optional.ofNullable(properties.get(name));
    }

    public List<String> getRequired() {
        return required;
    }

    public Optional<Schema> getItems() {
        return Optional.ofNullable(items);
    }

    public List<Object> getEnumValues() {
        return enumValues;
    }

    public Optional<Double> getMin() {
        return Optional.ofNullable(min);
    }

    public Optional<Double> getMax() {
        return Optional.ofNullable(max);
    }

    public Optional<Integer> getMinLength() {
        return Optional.ofNullable(minLength);
    }

    public Optional<Integer> getMaxLength() {
        return Optional.ofNullable(maxLength);
    }

    public Optional<String> getPattern() {
        return Optional.ofNullable(pattern).map(Pattern::pattern);
    }

    public Optional<String> getTitle() {
        return Optional.ofNullable(title);
    }

    public Optional<String> getDescription() {
        return Optional.ofNullable(description);
    }

    public boolean isOptional() {
        return optional;
    }

    public Optional<Object> getDefaultValue() {
        return Optional.ofNullable(defaultValue);
    }

    public List<Object> getExamples() {
        return examples;
    }

    @Override
    public String toString() {
        return "Schema" + describe();
    }

    /**
     * Schema 빌더.
     *
     * <p>{@link #build()} 시점에 불변식을 검증합니다.</p>
     */
    public static final class Builder {

        private final SchemaType type;
        private final Map<String, Field> properties = new LinkedHashMap<>();
        private final List<String> required = new ArrayList<>();
        private Schema items;
        private final List<Object> enumValues = new ArrayList<>();
        private Double min;
        private Double max;
        private Integer minLength;
        private Integer maxLength;
        private Pattern pattern;
        private String title;
        private String description;
        private boolean optional;
        private Object defaultValue;
        private final List<Object> examples = new ArrayList<>();

        private Builder(SchemaType type) {
            if (type == null) {
                throw new IllegalArgumentException("type cannot be null");
            }
            this.type = type;
        }

        public Builder property(String name, Schema schema) {
            properties.put(name, Field.of(name, schema));
            return this;
        }

        public Builder property(String name, Builder schema) {
            return property(name, schema.build());
        }

        public Builder required(String... names) {
            required.addAll(Arrays.asList(names));
            return this;
        }

        public Builder items(Schema items) {
            if (items == null) {
                throw new IllegalArgumentException("items cannot be null");
            }
            this.items = items;
            return this;
        }

        public Builder enumValues(Object... values) {
            enumValues.addAll(Arrays.asList(values));
            return this;
        }

        public Builder min(double min) {
            this.min = min;
            return this;
        }

        public Builder max(double max) {
            this.max = max;
            return this;
        }

        public Builder minLength(int minLength) {
            this.minLength = minLength;
            return this;
        }

        public Builder maxLength(int maxLength) {
            this.maxLength = maxLength;
            return this;
        }

        /**
         * 전체 일치해야 하는 정규식.
         *
         * @throws IllegalArgumentException 정규식 문법 오류
         */
        public Builder pattern(String regex) {
            try {
                this.pattern = Pattern.compile(regex);
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException("invalid pattern \"" + regex + "\"", e);
            }
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder optional() {
            this.optional = true;
            return this;
        }

        public Builder defaultValue(Object defaultValue) {
            this.defaultValue = defaultValue;
            return this;
        }

        public Builder examples(Object... values) {
            examples.addAll(Arrays.asList(values));
            return this;
        }

        /**
         * 불변 Schema 생성.
         *
         * @return Schema
         * @throws IllegalArgumentException 불변식 위반 시
         */
        public Schema build() {
            if (type == SchemaType.ARRAY && items == null) {
                throw new IllegalArgumentException("array schema must carry items");
            }
            if (type != SchemaType.ARRAY && items != null) {
                throw new IllegalArgumentException("items is only allowed on array schema (type: " + type + ")");
            }
            if (type != SchemaType.OBJECT && (!properties.isEmpty() || !required.isEmpty())) {
                throw new IllegalArgumentException("properties/required are only allowed on object schema (type: " + type + ")");
            }
            for (String name : required) {
                if (!properties.containsKey(name)) {
                    throw new IllegalArgumentException("required field \"" + name + "\" is not a declared property");
                }
            }
            if (min != null && max != null && min > max) {
                throw new IllegalArgumentException("min must not exceed max (min: " + min + ", max: " + max + ")");
            }
            if (minLength != null && maxLength != null && minLength > maxLength) {
                throw new IllegalArgumentException(
                    "minLength must not exceed maxLength (minLength: " + minLength + ", maxLength: " + maxLength + ")"
                );
            }
            return new Schema(this);
        }
    }
}
