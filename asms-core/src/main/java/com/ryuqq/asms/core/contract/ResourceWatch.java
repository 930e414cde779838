package com.ryuqq.asms.core.contract;

import com.ryuqq.asms.core.context.Cancellable;

import java.util.concurrent.TimeUnit;

/**
 * Resource 변경 알림을 받는 수신 측 핸들.
 *
 * <p><strong>종료 조건:</strong> watch를 연 컨텍스트가 종료되거나 {@link #cancel()}이 호출되면
 * 더 이상 알림이 생산되지 않습니다. 이미 버퍼에 있는 알림은 계속 poll할 수 있습니다.</p>
 *
 * <p>버퍼가 가득 차면 생산자는 블로킹하지 않고 새 알림을 버립니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ResourceWatch extends Cancellable, AutoCloseable {

    /**
     * 다음 알림을 최대 timeout 동안 대기.
     *
     * @return 알림, 시간 초과 또는 종료 후 버퍼가 비었으면 null
     * @throws InterruptedException 대기 중 인터럽트
     */
    ResourceUpdate poll(long timeout, TimeUnit unit) throws InterruptedException;

    /**
     * 종료되어 더 이상 받을 알림이 없는지 확인.
     *
     * @return 생산이 중단되었고 버퍼가 비었으면 true
     */
    boolean isClosed();

    @Override
    default void close() {
        cancel();
    }
}
