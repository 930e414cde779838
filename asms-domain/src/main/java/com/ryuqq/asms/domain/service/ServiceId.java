package com.ryuqq.asms.domain.service;

import com.ryuqq.asms.core.error.ErrorCode;
import com.ryuqq.asms.core.error.UnitException;

/**
 * 서비스 ID 값 객체 ({@code svc-<engine>-<model>}).
 *
 * <p>엔진 이름에는 '-'가 올 수 없고, 모델 이름에는 올 수 있습니다.
 * {@code svc-vllm-llama-3-8b}는 엔진 {@code vllm}, 모델 {@code llama-3-8b}입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param engine 엔진 이름
 * @param model 모델 이름
 */
public record ServiceId(String engine, String model) {

    public static final String PREFIX = "svc-";

    public ServiceId {
        if (engine == null || engine.isEmpty() || engine.contains("-")) {
            throw new IllegalArgumentException("engine must be non-empty and free of '-' (current: " + engine + ")");
        }
        if (model == null || model.isEmpty()) {
            throw new IllegalArgumentException("model cannot be empty");
        }
    }

    /**
     * 서비스 ID 파싱.
     *
     * @throws UnitException 형식이 맞지 않는 경우 (invalid_service_id)
     */
    public static ServiceId parse(String id) {
        if (id == null || !id.startsWith(PREFIX)) {
            throw UnitException.of(ServiceEvents.DOMAIN, ErrorCode.INVALID_SERVICE_ID,
                "invalid service ID: " + id + " (must start with '" + PREFIX + "')");
        }
        String rest = id.substring(PREFIX.length());
        int separator = rest.indexOf('-');
        if (separator <= 0 || separator == rest.length() - 1) {
            throw UnitException.of(ServiceEvents.DOMAIN, ErrorCode.INVALID_SERVICE_ID,
                "invalid service ID format: " + id + " (expected svc-{engine}-{model})");
        }
        return new ServiceId(rest.substring(0, separator), rest.substring(separator + 1));
    }

    public static boolean isValid(String id) {
        try {
            parse(id);
            return true;
        } catch (UnitException e) {
            return false;
        }
    }

    public String format() {
        return PREFIX + engine + "-" + model;
    }

    @Override
    public String toString() {
        return format();
    }
}
