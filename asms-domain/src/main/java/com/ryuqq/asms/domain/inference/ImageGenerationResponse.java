package com.ryuqq.asms.domain.inference;

import java.util.List;

/**
 * 이미지 생성 응답.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param images 생성된 이미지 목록
 * @param format 포맷 (예: "png")
 */
public record ImageGenerationResponse(List<GeneratedImage> images, String format) {

    public ImageGenerationResponse {
        images = images == null ? List.of() : List.copyOf(images);
    }
}
