package com.ryuqq.asms.domain.service;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * 모델 추론 서비스.
 *
 * <p><strong>불변 조건:</strong></p>
 * <ul>
 *   <li>replicas, activeReplicas는 0 이상</li>
 *   <li>createdAt ≤ updatedAt (둘 다 설정된 경우)</li>
 * </ul>
 *
 * <p>타임스탬프는 저장소가 채웁니다. 저장 전에는 null일 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param id 서비스 ID
 * @param name 표시 이름
 * @param modelId 서빙하는 모델 ID
 * @param status 상태
 * @param replicas 목표 replica 수
 * @param activeReplicas 실제 동작 중인 replica 수
 * @param resourceClass 자원 등급
 * @param endpoints 접근 endpoint 목록
 * @param config 엔진별 설정
 * @param createdAt 생성 시각 (nullable)
 * @param updatedAt 갱신 시각 (nullable)
 */
public record ModelService(
    String id,
    String name,
    String modelId,
    ServiceStatus status,
    int replicas,
    int activeReplicas,
    ResourceClass resourceClass,
    List<String> endpoints,
    Map<String, Object> config,
    Instant createdAt,
    Instant updatedAt
) {

    public ModelService {
        id = id == null ? "" : id;
        name = name == null ? "" : name;
        modelId = modelId == null ? "" : modelId;
        status = status == null ? ServiceStatus.PENDING : status;
        resourceClass = resourceClass == null ? ResourceClass.MEDIUM : resourceClass;
        endpoints = endpoints == null ? List.of() : List.copyOf(endpoints);
        config = config == null ? Map.of() : Map.copyOf(config);
        if (replicas < 0) {
            throw new IllegalArgumentException("replicas must be non-negative (current: " + replicas + ")");
        }
        if (activeReplicas < 0) {
            throw new IllegalArgumentException(
                "activeReplicas must be non-negative (current: " + activeReplicas + ")");
        }
        if (createdAt != null && updatedAt != null && updatedAt.isBefore(createdAt)) {
            throw new IllegalArgumentException("updatedAt must not be before createdAt");
        }
    }

    /**
     * 새 서비스 (pending, 타임스탬프 없음).
     */
    public static ModelService of(String id, String modelId, ResourceClass resourceClass, int replicas,
                                  List<String> endpoints) {
        return new ModelService(id, "service-" + id, modelId, ServiceStatus.PENDING, replicas, 0, resourceClass,
            endpoints, Map.of(), null, null);
    }

    public ModelService withStatus(ServiceStatus status) {
        return new ModelService(id, name, modelId, status, replicas, activeReplicas, resourceClass, endpoints,
            config, createdAt, updatedAt);
    }

    public ModelService withReplicas(int replicas) {
        return new ModelService(id, name, modelId, status, replicas, activeReplicas, resourceClass, endpoints,
            config, createdAt, updatedAt);
    }

    public ModelService withActiveReplicas(int activeReplicas) {
        return new ModelService(id, name, modelId, status, replicas, activeReplicas, resourceClass, endpoints,
            config, createdAt, updatedAt);
    }

    public ModelService withTimestamps(Instant createdAt, Instant updatedAt) {
        return new ModelService(id, name, modelId, status, replicas, activeReplicas, resourceClass, endpoints,
            config, createdAt, updatedAt);
    }
}
