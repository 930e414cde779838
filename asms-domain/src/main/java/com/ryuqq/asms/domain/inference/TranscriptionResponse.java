package com.ryuqq.asms.domain.inference;

import java.util.List;

/**
 * 음성 인식 응답.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param text 전체 텍스트
 * @param segments 구간 목록
 * @param language 언어 코드
 * @param duration 오디오 길이 (초)
 */
public record TranscriptionResponse(String text, List<TranscriptionSegment> segments, String language, double duration) {

    public TranscriptionResponse {
        segments = segments == null ? List.of() : List.copyOf(segments);
    }
}
