package com.ryuqq.asms.domain.inference;

/**
 * 생성된 이미지 하나. provider에 따라 url 또는 base64 중 하나만 채워질 수 있습니다.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param url 이미지 URL (nullable)
 * @param base64 Base64 인코딩 이미지 (nullable)
 */
public record GeneratedImage(String url, String base64) {

    public static GeneratedImage ofBase64(String base64) {
        return new GeneratedImage(null, base64);
    }

    public static GeneratedImage ofUrl(String url) {
        return new GeneratedImage(url, null);
    }
}
