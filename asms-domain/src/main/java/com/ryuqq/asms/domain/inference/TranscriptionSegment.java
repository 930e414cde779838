package com.ryuqq.asms.domain.inference;

/**
 * 음성 인식 구간.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param id 구간 번호
 * @param start 시작 (초)
 * @param end 끝 (초)
 * @param text 인식된 텍스트
 */
public record TranscriptionSegment(int id, double start, double end, String text) {
}
