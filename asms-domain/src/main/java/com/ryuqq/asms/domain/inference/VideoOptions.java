package com.ryuqq.asms.domain.inference;

/**
 * 영상 생성 옵션. null 값은 provider 기본값.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param duration 길이 (초)
 * @param fps 초당 프레임
 * @param width 너비
 * @param height 높이
 * @param steps diffusion step 수
 * @param seed 난수 seed
 */
public record VideoOptions(Double duration, Integer fps, Integer width, Integer height, Integer steps, Long seed) {

    public static final VideoOptions DEFAULT = new VideoOptions(null, null, null, null, null, null);
}
