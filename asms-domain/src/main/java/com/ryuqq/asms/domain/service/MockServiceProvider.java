package com.ryuqq.asms.domain.service;

import com.ryuqq.asms.core.context.CallContext;
import com.ryuqq.asms.core.error.ErrorCode;
import com.ryuqq.asms.core.error.UnitException;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 메모리 상태만 갖는 ServiceProvider.
 *
 * <p><strong>조절 가능한 동작:</strong></p>
 * <ul>
 *   <li>{@link #failStartWith(RuntimeException)}, {@link #failStopWith(RuntimeException)},
 *       {@link #failScaleWith(RuntimeException)} - 해당 호출 실패</li>
 *   <li>{@link #setStartDelay(Duration)} - start 지연 (취소 시 즉시 중단)</li>
 * </ul>
 *
 * <p>start에 성공한 서비스만 {@link #isRunning}이 true입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class MockServiceProvider implements ServiceProvider {

    public static final String ENGINE = "mock";
    public static final String ENDPOINT = "http://localhost:8080";

    private final Set<String> running = ConcurrentHashMap.newKeySet();
    private final AtomicInteger startCalls = new AtomicInteger();
    private final AtomicInteger stopCalls = new AtomicInteger();
    private volatile RuntimeException startFailure;
    private volatile RuntimeException stopFailure;
    private volatile RuntimeException scaleFailure;
    private volatile long startDelayMs;

    public void failStartWith(RuntimeException error) {
        this.startFailure = error;
    }

    public void failStopWith(RuntimeException error) {
        this.stopFailure = error;
    }

    public void failScaleWith(RuntimeException error) {
        this.scaleFailure = error;
    }

    public void clearFailures() {
        this.startFailure = null;
        this.stopFailure = null;
        this.scaleFailure = null;
    }

    public void setStartDelay(Duration delay) {
        this.startDelayMs = delay.toMillis();
    }

    public int startCalls() {
        return startCalls.get();
    }

    public int stopCalls() {
        return stopCalls.get();
    }

    @Override
    public ModelService create(CallContext ctx, String modelId, ResourceClass resourceClass, int replicas,
                               boolean persistent) {
        ctx.throwIfDone();
        String id = new ServiceId(ENGINE, modelId).format();
        return ModelService.of(id, modelId, resourceClass, replicas, List.of(ENDPOINT));
    }

    @Override
    public void start(CallContext ctx, String serviceId) {
        ctx.throwIfDone();
        startCalls.incrementAndGet();
        awaitStartDelay(ctx);
        RuntimeException error = startFailure;
        if (error != null) {
            throw error;
        }
        running.add(serviceId);
    }

    @Override
    public void stop(CallContext ctx, String serviceId, boolean force) {
        ctx.throwIfDone();
        stopCalls.incrementAndGet();
        RuntimeException error = stopFailure;
        if (error != null) {
            throw error;
        }
        running.remove(serviceId);
    }

    @Override
    public void scale(CallContext ctx, String serviceId, int replicas) {
        ctx.throwIfDone();
        RuntimeException error = scaleFailure;
        if (error != null) {
            throw error;
        }
    }

    @Override
    public ServiceMetrics getMetrics(CallContext ctx, String serviceId) {
        ctx.throwIfDone();
        if (!running.contains(serviceId)) {
            throw UnitException.of(ServiceEvents.DOMAIN, ErrorCode.SERVICE_NOT_RUNNING,
                "service not running: " + serviceId);
        }
        return new ServiceMetrics(100.0, 50.0, 200.0, 10000, 0.01);
    }

    @Override
    public Recommendation getRecommendation(CallContext ctx, String modelId, String hint) {
        ctx.throwIfDone();
        String model = modelId.toLowerCase(Locale.ROOT);
        if ("high-throughput".equals(hint)) {
            return new Recommendation(ResourceClass.MEDIUM, 4, 200.0, "vllm", "gpu",
                "High-throughput configuration with multiple replicas");
        }
        if (model.contains("whisper") || model.contains("sensevoice")) {
            return new Recommendation(ResourceClass.SMALL, 1, 10.0, "whisper", "cpu",
                "ASR model runs efficiently on CPU");
        }
        if (model.contains("70b")) {
            return new Recommendation(ResourceClass.LARGE, 2, 100.0, "vllm", "gpu",
                "Large LLM model recommended for GPU acceleration with vLLM");
        }
        return new Recommendation(ResourceClass.MEDIUM, 2, 100.0, "vllm", "gpu", "Default configuration");
    }

    @Override
    public boolean isRunning(CallContext ctx, String serviceId) {
        ctx.throwIfDone();
        return running.contains(serviceId);
    }

    private void awaitStartDelay(CallContext ctx) {
        long delay = startDelayMs;
        if (delay <= 0) {
            return;
        }
        try {
            if (ctx.awaitDone(delay, TimeUnit.MILLISECONDS)) {
                throw ctx.err();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UnitException(ErrorCode.SERVICE_START_FAILED, ServiceEvents.DOMAIN,
                "mock start interrupted", null, e);
        }
    }
}
