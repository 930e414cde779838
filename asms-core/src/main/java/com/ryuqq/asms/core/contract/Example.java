package com.ryuqq.asms.core.contract;

/**
 * Unit 문서용 입력/출력 예시.
 *
 * <p>런타임에 검증되지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param input 예시 입력
 * @param output 예시 출력
 * @param description 설명
 */
public record Example(Object input, Object output, String description) {

    public static Example of(Object input, Object output, String description) {
        return new Example(input, output, description);
    }
}
