package com.ryuqq.asms.core.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Unit 실행 중 발생하는 도메인 태그 예외.
 *
 * <p>모든 Unit, Store, Provider는 실패를 이 예외로 표현합니다. 호출자는 메시지가 아니라
 * {@link ErrorCode}로 분기합니다.</p>
 *
 * <p><strong>전파 규칙:</strong></p>
 * <ul>
 *   <li>로컬 전제조건 위반은 즉시 코드가 지정된 예외로 실패</li>
 *   <li>하위 호출 실패는 {@link #wrap(String, Throwable)}으로 문맥 문구를 붙여 재전파</li>
 *   <li>래핑 후에도 {@link #hasCode(Throwable, ErrorCode)}는 원래 코드를 찾음</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * try {
 *     store.createRule(ctx, rule);
 * } catch (UnitException e) {
 *     throw UnitException.wrap("create rule", e);
 * }
 *
 * if (UnitException.hasCode(error, ErrorCode.ALERT_RULE_NOT_FOUND)) { ... }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class UnitException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorCode code;
    private final String domain;
    private final Map<String, Object> details;

    /**
     * 도메인 없는 예외 생성.
     *
     * @param code 에러 코드
     * @param message 메시지
     */
    public UnitException(ErrorCode code, String message) {
        this(code, null, message, Map.of(), null);
    }

    /**
     * 도메인 태그 예외 생성.
     *
     * @param code 에러 코드
     * @param domain 도메인 (nullable)
     * @param message 메시지
     */
    public UnitException(ErrorCode code, String domain, String message) {
        this(code, domain, message, Map.of(), null);
    }

    /**
     * 전체 생성자.
     *
     * @param code 에러 코드 (null 불가)
     * @param domain 도메인 (nullable)
     * @param message 메시지
     * @param details 부가 정보 (nullable)
     * @param cause 원인 (nullable)
     * @throws IllegalArgumentException code가 null인 경우
     */
    public UnitException(ErrorCode code, String domain, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        if (code == null) {
            throw new IllegalArgumentException("code cannot be null");
        }
        this.code = code;
        this.domain = domain;
        this.details = details == null || details.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static UnitException of(ErrorCode code, String message) {
        return new UnitException(code, message);
    }

    public static UnitException of(String domain, ErrorCode code, String message) {
        return new UnitException(code, domain, message);
    }

    /**
     * 원인 예외에 문맥 문구를 붙여 래핑.
     *
     * <p>원인 체인에서 가장 가까운 {@link UnitException}의 코드와 도메인을 그대로 유지합니다.
     * 체인에 UnitException이 없으면 {@link ErrorCode#INTERNAL_ERROR}로 분류됩니다.</p>
     *
     * @param context 문맥 문구 (예: "create rule")
     * @param cause 원인 예외
     * @return 래핑된 예외
     * @throws IllegalArgumentException cause가 null인 경우
     */
    public static UnitException wrap(String context, Throwable cause) {
        if (cause == null) {
            throw new IllegalArgumentException("cause cannot be null");
        }
        Optional<UnitException> typed = find(cause);
        ErrorCode code = typed.map(UnitException::getCode).orElse(ErrorCode.INTERNAL_ERROR);
        String domain = typed.map(UnitException::getDomain).orElse(null);
        Map<String, Object> details = typed.map(UnitException::getDetails).orElse(Map.of());
        return new UnitException(code, domain, context + ": " + cause.getMessage(), details, cause);
    }

    /**
     * 부가 정보를 추가한 새 예외 생성.
     *
     * @param key 키
     * @param value 값
     * @return 새 예외 (원인 유지)
     */
    public UnitException withDetail(String key, Object value) {
        Map<String, Object> merged = new LinkedHashMap<>(details);
        merged.put(key, value);
        return new UnitException(code, domain, getMessage(), merged, getCause());
    }

    /**
     * 원인 체인에서 첫 번째 UnitException 조회.
     *
     * @param error 시작 예외 (nullable)
     * @return UnitException, 없으면 empty
     */
    public static Optional<UnitException> find(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof UnitException unitException) {
                return Optional.of(unitException);
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return Optional.empty();
    }

    /**
     * 원인 체인 어딘가에 주어진 코드의 UnitException이 있는지 확인.
     *
     * @param error 검사할 예외 (nullable)
     * @param code 찾을 코드
     * @return 일치 여부
     */
    public static boolean hasCode(Throwable error, ErrorCode code) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof UnitException unitException && unitException.code == code) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }

    public static boolean isNotFound(Throwable error) {
        return find(error).map(e -> e.code.getCategory() == ErrorCategory.NOT_FOUND).orElse(false);
    }

    public static boolean isAlreadyExists(Throwable error) {
        return hasCode(error, ErrorCode.ALREADY_EXISTS);
    }

    public static boolean isTimeout(Throwable error) {
        return hasCode(error, ErrorCode.TIMEOUT) || hasCode(error, ErrorCode.INFERENCE_TIMEOUT);
    }

    public static boolean isRateLimited(Throwable error) {
        return hasCode(error, ErrorCode.RATE_LIMITED) || hasCode(error, ErrorCode.INFERENCE_RATE_LIMITED);
    }

    /**
     * 이 예외가 주어진 코드인지 확인.
     *
     * @param other 비교할 코드
     * @return 코드 일치 여부
     */
    public boolean is(ErrorCode other) {
        return code == other;
    }

    public ErrorCode getCode() {
        return code;
    }

    public String getDomain() {
        return domain;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    @Override
    public String toString() {
        return "UnitException{code=" + code.getValue()
            + (domain != null ? ", domain=" + domain : "")
            + ", message=" + getMessage() + "}";
    }
}
