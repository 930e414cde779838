package com.ryuqq.asms.core.error;

import java.util.Optional;

/**
 * 안정적인 에러 코드.
 *
 * <p>코드 문자열은 외부 계약이므로 변경하지 않습니다. 메시지는 자유롭게 바뀔 수 있지만
 * 호출자는 항상 코드로 분기해야 합니다.</p>
 *
 * <p><strong>분류:</strong></p>
 * <ul>
 *   <li>입력: invalid_input 및 파라미터별 변형</li>
 *   <li>리소스: not_found, already_exists, 도메인별 *_not_found</li>
 *   <li>작업: *_failed, *_timeout, *_rate_limited, *_unreachable</li>
 *   <li>내부: internal_error, provider_not_set</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ErrorCode {

    // input
    INVALID_INPUT("invalid_input", ErrorCategory.INPUT),
    VALIDATION_FAILED("validation_failed", ErrorCategory.INPUT),
    INVALID_DEVICE_ID("invalid_device_id", ErrorCategory.INPUT),
    INVALID_POWER_LIMIT("invalid_power_limit", ErrorCategory.INPUT),
    INVALID_SERVICE_ID("invalid_service_id", ErrorCategory.INPUT),
    INFERENCE_INVALID_PARAMS("inference_invalid_params", ErrorCategory.INPUT),

    // resource
    NOT_FOUND("not_found", ErrorCategory.NOT_FOUND),
    ALREADY_EXISTS("already_exists", ErrorCategory.CONFLICT),
    UNIT_NOT_FOUND("unit_not_found", ErrorCategory.NOT_FOUND),
    ALERT_RULE_NOT_FOUND("alert_rule_not_found", ErrorCategory.NOT_FOUND),
    ALERT_NOT_FOUND("alert_not_found", ErrorCategory.NOT_FOUND),
    DEVICE_NOT_FOUND("device_not_found", ErrorCategory.NOT_FOUND),
    SERVICE_NOT_FOUND("service_not_found", ErrorCategory.NOT_FOUND),
    INFERENCE_MODEL_NOT_LOADED("inference_model_not_loaded", ErrorCategory.NOT_FOUND),

    // operation
    TIMEOUT("timeout", ErrorCategory.OPERATION),
    RATE_LIMITED("rate_limited", ErrorCategory.OPERATION),
    INFERENCE_TIMEOUT("inference_timeout", ErrorCategory.OPERATION),
    INFERENCE_RATE_LIMITED("inference_rate_limited", ErrorCategory.OPERATION),
    INFERENCE_ENGINE_ERROR("inference_engine_error", ErrorCategory.OPERATION),
    SERVICE_START_FAILED("service_start_failed", ErrorCategory.OPERATION),
    SERVICE_SCALE_FAILED("service_scale_failed", ErrorCategory.OPERATION),
    SERVICE_NOT_RUNNING("service_not_running", ErrorCategory.OPERATION),
    DEVICE_UNREACHABLE("device_unreachable", ErrorCategory.OPERATION),
    DEVICE_METRICS_ERROR("device_metrics_error", ErrorCategory.OPERATION),

    // internal
    PROVIDER_NOT_SET("provider_not_set", ErrorCategory.INTERNAL),
    INTERNAL_ERROR("internal_error", ErrorCategory.INTERNAL);

    private final String value;
    private final ErrorCategory category;

    ErrorCode(String value, ErrorCategory category) {
        this.value = value;
        this.category = category;
    }

    /**
     * 외부로 노출되는 코드 문자열.
     *
     * @return 코드 (예: "invalid_input")
     */
    public String getValue() {
        return value;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    /**
     * 코드 문자열로 ErrorCode 조회.
     *
     * @param value 코드 문자열
     * @return 일치하는 ErrorCode, 없으면 empty
     */
    public static Optional<ErrorCode> fromValue(String value) {
        for (ErrorCode code : values()) {
            if (code.value.equals(value)) {
                return Optional.of(code);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return value;
    }
}
