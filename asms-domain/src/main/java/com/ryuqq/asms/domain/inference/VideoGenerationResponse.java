package com.ryuqq.asms.domain.inference;

import java.util.Arrays;
import java.util.Objects;

/**
 * 영상 생성 응답.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param video 영상 바이트
 * @param format 포맷 (예: "mp4")
 * @param duration 길이 (초)
 */
public record VideoGenerationResponse(byte[] video, String format, double duration) {

    public VideoGenerationResponse {
        video = video == null ? new byte[0] : video.clone();
    }

    @Override
    public byte[] video() {
        return video.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof VideoGenerationResponse other)) {
            return false;
        }
        return Double.compare(duration, other.duration) == 0
            && Arrays.equals(video, other.video)
            && Objects.equals(format, other.format);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * Arrays.hashCode(video) + Objects.hashCode(format)) + Double.hashCode(duration);
    }

    @Override
    public String toString() {
        return "VideoGenerationResponse{bytes=" + video.length + ", format=" + format + ", duration=" + duration + "}";
    }
}
