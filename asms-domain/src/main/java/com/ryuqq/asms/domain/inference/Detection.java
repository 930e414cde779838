package com.ryuqq.asms.domain.inference;

/**
 * 검출된 객체.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param label 레이블
 * @param confidence 신뢰도 (0~1)
 * @param bbox 위치
 */
public record Detection(String label, double confidence, BBox bbox) {

    public Detection {
        if (bbox == null) {
            throw new IllegalArgumentException("bbox cannot be null");
        }
    }
}
