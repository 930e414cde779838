package com.ryuqq.asms.core.context;

/**
 * {@link CallContext}가 종료되었음을 나타내는 예외.
 *
 * <p>하나의 컨텍스트는 종료 시점에 정확히 하나의 인스턴스를 만들고 {@link CallContext#err()}는
 * 항상 그 인스턴스를 반환합니다. 스트림과 Watch는 이 인스턴스를 그대로 던집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ContextCancelledException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * 종료 사유.
     */
    public enum Reason {
        CANCELED("context canceled"),
        DEADLINE_EXCEEDED("context deadline exceeded");

        private final String message;

        Reason(String message) {
            this.message = message;
        }
    }

    private final Reason reason;

    ContextCancelledException(Reason reason) {
        super(reason.message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    public boolean isDeadlineExceeded() {
        return reason == Reason.DEADLINE_EXCEEDED;
    }
}
