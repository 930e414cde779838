package com.ryuqq.asms.core.schema;

import com.ryuqq.asms.core.error.ErrorCode;
import com.ryuqq.asms.core.error.UnitException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Schema 검증 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class SchemaTest {

    private static final Schema RULE_SCHEMA = Schema.object()
        .property("name", Schema.string().minLength(1).maxLength(100))
        .property("severity", Schema.string().enumValues("critical", "warning", "info"))
        .property("threshold", Schema.number().min(0).max(100))
        .property("enabled", Schema.bool())
        .property("tags", Schema.arrayOf(Schema.string()))
        .required("name", "severity")
        .build();

    // ==================== 정상 입력 ====================

    @Test
    void validate_ValidInput_Passes() {
        // Given
        Map<String, Object> input = Map.of(
            "name", "gpu-hot",
            "severity", "critical",
            "threshold", 85,
            "enabled", true,
            "tags", List.of("gpu", "temp")
        );

        // When & Then
        assertDoesNotThrow(() -> RULE_SCHEMA.validate(input));
        assertTrue(RULE_SCHEMA.isValid(input));
    }

    @Test
    void validate_IntegerAndDoubleBothAcceptedAsNumber() {
        assertTrue(RULE_SCHEMA.isValid(Map.of("name", "a", "severity", "info", "threshold", 12)));
        assertTrue(RULE_SCHEMA.isValid(Map.of("name", "a", "severity", "info", "threshold", 12.5d)));
        assertTrue(RULE_SCHEMA.isValid(Map.of("name", "a", "severity", "info", "threshold", 12L)));
    }

    @Test
    void validate_UnknownFieldsAreIgnored() {
        assertTrue(RULE_SCHEMA.isValid(Map.of("name", "a", "severity", "info", "extra", "x")));
    }

    // ==================== 실패 입력 ====================

    @Test
    void validate_MissingRequiredField_NamesField() {
        // When
        UnitException exception = assertThrows(
            UnitException.class,
            () -> RULE_SCHEMA.validate(Map.of("name", "a"))
        );

        // Then
        assertEquals(ErrorCode.INVALID_INPUT, exception.getCode());
        assertTrue(exception.getMessage().contains("severity"));
    }

    @Test
    void validate_MissingRequiredReportedBeforeOtherViolations() {
        // Given
        Schema createRule = Schema.object()
            .property("name", Schema.string().minLength(1))
            .property("condition", Schema.string().minLength(1))
            .property("severity", Schema.string().enumValues("critical", "warning", "info"))
            .required("name", "condition", "severity")
            .build();
        Map<String, Object> input = Map.of("name", "X", "severity", "urgent");

        // When
        UnitException first = assertThrows(UnitException.class, () -> createRule.validate(input));
        UnitException second = assertThrows(UnitException.class, () -> createRule.validate(input));

        // Then
        assertTrue(first.getMessage().contains("condition"));
        assertFalse(first.getMessage().contains("urgent"));
        assertEquals(first.getMessage(), second.getMessage());
        assertFalse(createRule.isValid(input));
    }

    @Test
    void validate_NonFiniteNumber_Fails() {
        Schema limit = Schema.object()
            .property("limit_watts", Schema.number().min(0))
            .build();

        UnitException exception = assertThrows(
            UnitException.class,
            () -> limit.validate(Map.of("limit_watts", Double.NaN))
        );

        assertEquals(ErrorCode.INVALID_INPUT, exception.getCode());
        assertEquals("limit_watts", exception.getDetails().get("path"));
        assertFalse(limit.isValid(Map.of("limit_watts", Double.POSITIVE_INFINITY)));
        assertFalse(Schema.number().build().isValid(Double.NaN));
    }

    @Test
    void validate_WrongType_NamesPath() {
        UnitException exception = assertThrows(
            UnitException.class,
            () -> RULE_SCHEMA.validate(Map.of("name", "a", "severity", "info", "enabled", "yes"))
        );

        assertEquals(ErrorCode.INVALID_INPUT, exception.getCode());
        assertTrue(exception.getMessage().contains("enabled"));
        assertEquals("enabled", exception.getDetails().get("path"));
    }

    @Test
    void validate_EnumViolation_Fails() {
        UnitException exception = assertThrows(
            UnitException.class,
            () -> RULE_SCHEMA.validate(Map.of("name", "a", "severity", "fatal"))
        );

        assertTrue(exception.getMessage().contains("severity"));
        assertTrue(exception.getMessage().contains("fatal"));
    }

    @Test
    void validate_NumberOutOfRange_Fails() {
        UnitException exception = assertThrows(
            UnitException.class,
            () -> RULE_SCHEMA.validate(Map.of("name", "a", "severity", "info", "threshold", 101))
        );

        assertTrue(exception.getMessage().contains("threshold"));
        assertTrue(exception.getMessage().contains("100"));
    }

    @Test
    void validate_StringTooLong_Fails() {
        String longName = "x".repeat(101);

        assertFalse(RULE_SCHEMA.isValid(Map.of("name", longName, "severity", "info")));
    }

    @Test
    void validate_EmptyStringBelowMinLength_Fails() {
        assertFalse(RULE_SCHEMA.isValid(Map.of("name", "", "severity", "info")));
    }

    @Test
    void validate_ArrayElementWrongType_ReportsIndex() {
        UnitException exception = assertThrows(
            UnitException.class,
            () -> RULE_SCHEMA.validate(Map.of("name", "a", "severity", "info", "tags", List.of("ok", 3)))
        );

        assertEquals("tags[1]", exception.getDetails().get("path"));
    }

    @Test
    void validate_NonObjectInput_Fails() {
        UnitException exception = assertThrows(UnitException.class, () -> RULE_SCHEMA.validate("text"));

        assertEquals(ErrorCode.INVALID_INPUT, exception.getCode());
        assertTrue(exception.getMessage().contains("expected object"));
    }

    @Test
    void validate_NullInput_Fails() {
        assertThrows(UnitException.class, () -> RULE_SCHEMA.validate(null));
    }

    @Test
    void validate_PatternMustMatchWholeString() {
        Schema deviceId = Schema.string().pattern("gpu-[0-9]+").build();

        assertTrue(deviceId.isValid("gpu-0"));
        assertFalse(deviceId.isValid("my-gpu-0"));
        assertFalse(deviceId.isValid("gpu-0x"));
    }

    @Test
    void validate_NestedObject_ReportsDottedPath() {
        Schema schema = Schema.object()
            .property("options", Schema.object()
                .property("temperature", Schema.number().min(0).max(2)))
            .build();

        UnitException exception = assertThrows(
            UnitException.class,
            () -> schema.validate(Map.of("options", Map.of("temperature", 3)))
        );

        assertEquals("options.temperature", exception.getDetails().get("path"));
    }

    // ==================== 빌더 불변식 ====================

    @Test
    void build_RequiredNotDeclared_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> Schema.object().property("a", Schema.string()).required("b").build()
        );
        assertTrue(exception.getMessage().contains("b"));
    }

    @Test
    void build_ItemsOnNonArray_ThrowsException() {
        assertThrows(
            IllegalArgumentException.class,
            () -> Schema.string().items(Schema.string().build()).build()
        );
    }

    @Test
    void build_MinGreaterThanMax_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> Schema.number().min(10).max(1).build());
    }

    @Test
    void build_PropertiesOnLeaf_ThrowsException() {
        assertThrows(
            IllegalArgumentException.class,
            () -> Schema.string().property("x", Schema.string()).build()
        );
    }

    @Test
    void describe_ExposesTypeAndProperties() {
        // When
        Map<String, Object> described = RULE_SCHEMA.describe();

        // Then
        assertEquals("object", described.get("type"));
        assertTrue(described.containsKey("properties"));
        assertEquals(List.of("name", "severity"), described.get("required"));
    }
}
