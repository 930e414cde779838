package com.ryuqq.asms.application.dispatch;

/**
 * Dispatcher 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>validateInput: 실행 전 입력 스키마 검증 (기본 true)</li>
 *   <li>validateOutput: 실행 후 출력 스키마 검증 (기본 false)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param validateInput 입력 검증 여부
 * @param validateOutput 출력 검증 여부
 */
public record DispatchConfig(boolean validateInput, boolean validateOutput) {

    /**
     * 기본 설정 생성자.
     */
    public DispatchConfig() {
        this(true, false);
    }

    public DispatchConfig withValidateInput(boolean validateInput) {
        return new DispatchConfig(validateInput, validateOutput);
    }

    public DispatchConfig withValidateOutput(boolean validateOutput) {
        return new DispatchConfig(validateInput, validateOutput);
    }
}
