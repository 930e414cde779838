package com.ryuqq.asms.core.contract;

import com.ryuqq.asms.core.context.CallContext;

import java.util.concurrent.BlockingQueue;

/**
 * 스트리밍 실행을 지원하는 Command.
 *
 * <p><strong>계약:</strong></p>
 * <ol>
 *   <li>outbound의 생명주기는 호출자가 소유 (생성과 정리)</li>
 *   <li>0개 이상의 {@code {type:"content", data, metadata}} 프레임을 생산 순서대로 전달</li>
 *   <li>Provider 스트림 완료, 컨텍스트 종료, 에러 중 하나가 발생하면 반환</li>
 *   <li>컨텍스트 종료 시 {@code ctx.err()}를 그대로 던짐</li>
 *   <li>스트림 내부 에러 프레임은 사용하지 않음 (에러는 예외로만 전달)</li>
 * </ol>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface StreamingCommand extends Command {

    @Override
    default boolean supportsStreaming() {
        return true;
    }

    /**
     * 스트리밍 실행.
     *
     * @param ctx 취소 토큰
     * @param input 동적 입력
     * @param outbound 호출자 소유의 bounded 큐
     * @throws com.ryuqq.asms.core.error.UnitException 실행 실패 시
     * @throws com.ryuqq.asms.core.context.ContextCancelledException 컨텍스트 종료 시 (ctx.err() 그대로)
     */
    void executeStream(CallContext ctx, Object input, BlockingQueue<StreamChunk> outbound);
}
