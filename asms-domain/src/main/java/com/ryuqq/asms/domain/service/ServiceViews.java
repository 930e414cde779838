package com.ryuqq.asms.domain.service;

import com.ryuqq.asms.domain.support.Timestamps;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Wire projections of services.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class ServiceViews {

    // Utility class - prevent instantiation
    private ServiceViews() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    static Map<String, Object> service(ModelService service) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", service.id());
        view.put("name", service.name());
        view.put("model_id", service.modelId());
        view.put("status", service.status().getValue());
        view.put("replicas", service.replicas());
        view.put("active_replicas", service.activeReplicas());
        view.put("resource_class", service.resourceClass().getValue());
        view.put("endpoints", service.endpoints());
        if (!service.config().isEmpty()) {
            view.put("config", service.config());
        }
        if (service.createdAt() != null) {
            view.put("created_at", Timestamps.format(service.createdAt()));
            view.put("updated_at", Timestamps.format(service.updatedAt()));
        }
        return view;
    }

    static Map<String, Object> summary(ModelService service) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", service.id());
        view.put("model_id", service.modelId());
        view.put("status", service.status().getValue());
        view.put("replicas", service.replicas());
        view.put("endpoints", service.endpoints());
        return view;
    }

    static Map<String, Object> status(ModelService service) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", service.id());
        view.put("name", service.name());
        view.put("model_id", service.modelId());
        view.put("status", service.status().getValue());
        view.put("replicas", service.replicas());
        view.put("active_replicas", service.activeReplicas());
        view.put("endpoints", service.endpoints());
        return view;
    }

    static Map<String, Object> page(ServicePage page) {
        List<Map<String, Object>> items = new ArrayList<>(page.services().size());
        for (ModelService service : page.services()) {
            items.add(summary(service));
        }
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("services", items);
        view.put("total", page.total());
        return view;
    }

    static Map<String, Object> metrics(ServiceMetrics metrics) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("requests_per_second", metrics.requestsPerSecond());
        view.put("latency_p50", metrics.latencyP50());
        view.put("latency_p99", metrics.latencyP99());
        view.put("total_requests", metrics.totalRequests());
        view.put("error_rate", metrics.errorRate());
        return view;
    }

    static Map<String, Object> recommendation(Recommendation recommendation) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("resource_class", recommendation.resourceClass().getValue());
        view.put("replicas", recommendation.replicas());
        view.put("expected_throughput", recommendation.expectedThroughput());
        view.put("engine_type", recommendation.engineType());
        view.put("device_type", recommendation.deviceType());
        view.put("reason", recommendation.reason());
        return view;
    }
}
