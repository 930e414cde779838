package com.ryuqq.asms.core.event;

/**
 * 이벤트 발행 계약.
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>best-effort: 발행 실패가 Unit 실행을 실패시키지 않음</li>
 *   <li>non-blocking: 호출 스레드를 오래 붙잡지 않음</li>
 *   <li>실행 간 순서는 보장하지 않아도 됨</li>
 * </ul>
 *
 * <p>publisher가 없는 구성(null)은 "버림"을 의미하며 {@link #orNoop(EventPublisher)}로 정규화합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface EventPublisher {

    /**
     * 이벤트 발행.
     *
     * @param event 발행할 이벤트
     */
    void publish(Event event);

    /**
     * null publisher를 {@link NoopEventPublisher}로 대체.
     *
     * @param publisher publisher (nullable)
     * @return null이 아닌 publisher
     */
    static EventPublisher orNoop(EventPublisher publisher) {
        return publisher != null ? publisher : NoopEventPublisher.INSTANCE;
    }
}
