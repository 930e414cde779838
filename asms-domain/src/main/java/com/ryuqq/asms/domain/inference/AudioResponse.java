package com.ryuqq.asms.domain.inference;

import java.util.Arrays;
import java.util.Objects;

/**
 * 음성 합성 응답.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param audio 오디오 바이트
 * @param format 포맷 (예: "wav")
 * @param duration 길이 (초)
 */
public record AudioResponse(byte[] audio, String format, double duration) {

    public AudioResponse {
        audio = audio == null ? new byte[0] : audio.clone();
    }

    @Override
    public byte[] audio() {
        return audio.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AudioResponse other)) {
            return false;
        }
        return Double.compare(duration, other.duration) == 0
            && Arrays.equals(audio, other.audio)
            && Objects.equals(format, other.format);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * Arrays.hashCode(audio) + Objects.hashCode(format)) + Double.hashCode(duration);
    }

    @Override
    public String toString() {
        return "AudioResponse{bytes=" + audio.length + ", format=" + format + ", duration=" + duration + "}";
    }
}
