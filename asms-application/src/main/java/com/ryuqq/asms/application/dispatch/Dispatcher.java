package com.ryuqq.asms.application.dispatch;

import com.ryuqq.asms.core.context.CallContext;
import com.ryuqq.asms.core.contract.ResourceWatch;
import com.ryuqq.asms.core.contract.StreamChunk;
import com.ryuqq.asms.core.error.ErrorResponse;

import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;

/**
 * Transport 계층이 사용하는 Unit 실행 진입점.
 *
 * <p>HTTP, MCP, CLI 같은 transport는 이름과 동적 입력만 전달하고,
 * 조회, 검증, 실행, 에러 변환은 Dispatcher가 담당합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * try {
 *     Map&lt;String, Object&gt; output = dispatcher.execute(ctx, "alert.create_rule", body);
 *     // 200 OK + output
 * } catch (RuntimeException e) {
 *     ErrorResponse error = dispatcher.toErrorResponse(e);
 *     // error.httpStatus() + {code, message, domain}
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Dispatcher {

    /**
     * Command 또는 Query 실행.
     *
     * @param ctx 취소 토큰
     * @param unitName Unit 이름 (예: {@code alert.create_rule})
     * @param input 동적 입력 (nullable, 빈 객체로 취급)
     * @return Unit 출력
     * @throws com.ryuqq.asms.core.error.UnitException 등록되지 않은 이름 (unit_not_found), 입력 검증 실패
     *         (invalid_input), 실행 실패
     */
    Map<String, Object> execute(CallContext ctx, String unitName, Object input);

    /**
     * 스트리밍 Command 실행.
     *
     * @param outbound 호출자 소유의 bounded 큐
     * @throws com.ryuqq.asms.core.error.UnitException 스트리밍을 지원하지 않는 Unit (invalid_input)
     * @throws com.ryuqq.asms.core.context.ContextCancelledException 컨텍스트 종료 시
     */
    void executeStream(CallContext ctx, String unitName, Object input, BlockingQueue<StreamChunk> outbound);

    /**
     * Resource 스냅샷.
     *
     * @throws com.ryuqq.asms.core.error.UnitException 해석할 수 없는 URI (not_found)
     */
    Object read(CallContext ctx, String uri);

    /**
     * Resource 구독. ctx가 종료되거나 반환된 watch를 취소하면 구독이 끝납니다.
     */
    ResourceWatch watch(CallContext ctx, String uri);

    /**
     * 등록된 Unit과 Resource 목록 (이름순).
     */
    List<CatalogEntry> catalog();

    /**
     * 예외를 transport 에러 페이로드로 변환.
     */
    ErrorResponse toErrorResponse(Throwable error);
}
