package com.ryuqq.asms.runtime.stream;

/**
 * Provider가 스트림 항목을 밀어 넣는 수신자.
 *
 * <p>버퍼가 가득 차면 블로킹하며, 컨텍스트가 종료되면
 * {@link com.ryuqq.asms.core.context.ContextCancelledException}을 던집니다.</p>
 *
 * @param <T> 항목 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface StreamSink<T> {

    void send(T item);
}
