package com.ryuqq.asms.domain.inference;

import java.util.List;

/**
 * 객체 검출 응답.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param detections 검출 목록
 * @param model 모델 ID
 */
public record DetectionResponse(List<Detection> detections, String model) {

    public DetectionResponse {
        detections = detections == null ? List.of() : List.copyOf(detections);
    }
}
