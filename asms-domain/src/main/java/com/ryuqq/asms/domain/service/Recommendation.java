package com.ryuqq.asms.domain.service;

/**
 * 모델별 권장 배포 구성.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param resourceClass 권장 자원 등급
 * @param replicas 권장 replica 수
 * @param expectedThroughput 예상 처리량 (req/s)
 * @param engineType 엔진 종류 (예: vllm)
 * @param deviceType 장치 종류 (예: gpu)
 * @param reason 권장 사유
 */
public record Recommendation(
    ResourceClass resourceClass,
    int replicas,
    double expectedThroughput,
    String engineType,
    String deviceType,
    String reason
) {

    public Recommendation {
        if (resourceClass == null) {
            throw new IllegalArgumentException("resourceClass cannot be null");
        }
        engineType = engineType == null ? "" : engineType;
        deviceType = deviceType == null ? "" : deviceType;
        reason = reason == null ? "" : reason;
    }
}
