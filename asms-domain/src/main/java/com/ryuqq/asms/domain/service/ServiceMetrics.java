package com.ryuqq.asms.domain.service;

/**
 * 실행 중인 서비스의 처리 지표.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param requestsPerSecond 초당 요청 수
 * @param latencyP50 지연 p50 (ms)
 * @param latencyP99 지연 p99 (ms)
 * @param totalRequests 누적 요청 수
 * @param errorRate 오류율 (0.0 ~ 1.0)
 */
public record ServiceMetrics(
    double requestsPerSecond,
    double latencyP50,
    double latencyP99,
    long totalRequests,
    double errorRate
) {
}
