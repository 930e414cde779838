package com.ryuqq.asms.runtime.event;

import com.ryuqq.asms.core.event.Event;
import com.ryuqq.asms.core.event.EventPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 모든 이벤트를 SLF4J 로그로 남기는 publisher.
 *
 * <p>이벤트 싱크가 없는 배포에서도 감사 기록이 남도록 기본 publisher로 사용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Slf4jEventPublisher implements EventPublisher {

    private final Logger log;

    public Slf4jEventPublisher() {
        this(LoggerFactory.getLogger(Slf4jEventPublisher.class));
    }

    /**
     * 지정한 Logger로 기록하는 publisher.
     *
     * @param log 대상 Logger (예: 도메인별 audit 로거)
     */
    public Slf4jEventPublisher(Logger log) {
        if (log == null) {
            throw new IllegalArgumentException("log cannot be null");
        }
        this.log = log;
    }

    @Override
    public void publish(Event event) {
        if (event == null) {
            return;
        }
        log.info("event type={} domain={} correlationId={} payload={}",
            event.type(), event.domain(), event.correlationId(), event.payload());
    }
}
