package com.ryuqq.asms.core.contract;

import com.ryuqq.asms.core.context.CallContext;
import com.ryuqq.asms.core.schema.Schema;

import java.util.List;
import java.util.Map;

/**
 * 균일하게 기술되는 연산 단위.
 *
 * <p>Transport는 Unit의 도메인을 몰라도 이름으로 찾고, 입력 스키마로 검증하고,
 * {@link #execute(CallContext, Object)}로 실행할 수 있습니다.</p>
 *
 * <p><strong>입력 규약:</strong> 동적 값의 키/값 맵 (text, 정수, 실수, boolean, 배열, 중첩 맵).</p>
 * <p><strong>출력 규약:</strong> 출력 스키마를 따르는 키/값 맵.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Unit {

    UnitDescriptor descriptor();

    UnitKind kind();

    /**
     * Unit 실행.
     *
     * @param ctx 취소 토큰
     * @param input 동적 입력
     * @return 동적 출력
     * @throws com.ryuqq.asms.core.error.UnitException 실행 실패 시
     * @throws com.ryuqq.asms.core.context.ContextCancelledException 컨텍스트 종료 시
     */
    Map<String, Object> execute(CallContext ctx, Object input);

    default String name() {
        return descriptor().name();
    }

    default String domain() {
        return descriptor().domain();
    }

    default String description() {
        return descriptor().description();
    }

    default Schema inputSchema() {
        return descriptor().inputSchema();
    }

    default Schema outputSchema() {
        return descriptor().outputSchema();
    }

    default List<Example> examples() {
        return descriptor().examples();
    }
}
