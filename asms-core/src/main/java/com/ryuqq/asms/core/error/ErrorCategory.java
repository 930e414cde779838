package com.ryuqq.asms.core.error;

/**
 * 에러 코드 분류.
 *
 * <p>Transport 계층은 이 분류만 보고 응답 형태를 결정합니다.</p>
 *
 * <ul>
 *   <li>INPUT: 잘못된 요청 (400)</li>
 *   <li>NOT_FOUND: 대상 없음 (404)</li>
 *   <li>CONFLICT: 이미 존재함 (409)</li>
 *   <li>OPERATION: 하위 시스템 작업 실패 (500)</li>
 *   <li>INTERNAL: 내부 오류 (500)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ErrorCategory {

    INPUT(400),
    NOT_FOUND(404),
    CONFLICT(409),
    OPERATION(500),
    INTERNAL(500);

    private final int httpStatus;

    ErrorCategory(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    /**
     * HTTP 형태의 상태 코드.
     *
     * @return 상태 코드
     */
    public int httpStatus() {
        return httpStatus;
    }
}
