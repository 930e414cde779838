package com.ryuqq.asms.domain.inference;

/**
 * 이미지 생성 옵션. null 값은 provider 기본값.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param size 크기 (예: "1024x1024")
 * @param steps diffusion step 수
 * @param seed 난수 seed
 * @param negativePrompt 제외할 내용
 * @param width 너비
 * @param height 높이
 */
public record ImageOptions(
    String size,
    Integer steps,
    Long seed,
    String negativePrompt,
    Integer width,
    Integer height
) {

    public static final ImageOptions DEFAULT = new ImageOptions(null, null, null, null, null, null);
}
