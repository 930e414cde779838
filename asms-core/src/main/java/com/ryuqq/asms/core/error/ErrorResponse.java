package com.ryuqq.asms.core.error;

import com.ryuqq.asms.core.context.ContextCancelledException;

/**
 * Transport 계층에 노출되는 에러 페이로드.
 *
 * <p>{@code {code, message, domain}} 형태이며 HTTP 형태의 상태 코드는 코드 분류에서 파생됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param code 에러 코드 문자열
 * @param message 메시지
 * @param domain 도메인 (nullable)
 * @param httpStatus 상태 코드
 */
public record ErrorResponse(String code, String message, String domain, int httpStatus) {

    public ErrorResponse {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("code cannot be null or blank");
        }
    }

    /**
     * 예외를 에러 페이로드로 변환.
     *
     * <ul>
     *   <li>체인에 UnitException이 있으면 그 코드와 도메인 사용</li>
     *   <li>데드라인 초과는 timeout, 취소는 internal_error</li>
     *   <li>그 외는 internal_error</li>
     * </ul>
     *
     * @param error 변환할 예외
     * @return 에러 페이로드
     */
    public static ErrorResponse from(Throwable error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        UnitException typed = UnitException.find(error).orElse(null);
        if (typed != null) {
            return of(typed.getCode(), error.getMessage(), typed.getDomain());
        }
        if (error instanceof ContextCancelledException cancelled && cancelled.isDeadlineExceeded()) {
            return of(ErrorCode.TIMEOUT, error.getMessage(), null);
        }
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return of(ErrorCode.INTERNAL_ERROR, message, null);
    }

    public static ErrorResponse of(ErrorCode code, String message, String domain) {
        return new ErrorResponse(code.getValue(), message, domain, code.getCategory().httpStatus());
    }
}
