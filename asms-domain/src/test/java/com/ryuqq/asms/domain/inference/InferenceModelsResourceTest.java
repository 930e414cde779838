package com.ryuqq.asms.domain.inference;

import com.ryuqq.asms.core.context.CallContext;
import com.ryuqq.asms.core.contract.Resource;
import com.ryuqq.asms.core.contract.ResourceOperation;
import com.ryuqq.asms.core.contract.ResourceUpdate;
import com.ryuqq.asms.core.contract.ResourceWatch;
import com.ryuqq.asms.core.error.UnitException;
import com.ryuqq.asms.core.registry.UnitRegistry;
import com.ryuqq.asms.runtime.stream.StreamBridge;
import com.ryuqq.asms.runtime.watch.ResourcePoller;
import com.ryuqq.asms.runtime.watch.WatchConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 모델 목록 Resource 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class InferenceModelsResourceTest {

    private final Clock clock = Clock.systemUTC();
    private final ResourcePoller poller = new ResourcePoller(2, clock);
    private final StreamBridge bridge = new StreamBridge();
    private final MockInferenceProvider provider = new MockInferenceProvider();
    private final InferenceModule module =
        new InferenceModule(provider, bridge, null, poller, WatchConfig.uniform(20), clock);

    @AfterEach
    void tearDown() throws InterruptedException {
        poller.shutdown();
        bridge.shutdown();
    }

    @Test
    void 모듈_등록_후_URI로_해석() {
        UnitRegistry registry = new UnitRegistry();
        module.registerInto(registry);

        Resource models = registry.resolveResource(InferenceModelsResource.URI);

        assertThat(models.uri()).isEqualTo("asms://inference/models");
        assertThat(registry.getCommand("inference.chat")).isPresent();
        assertThat(registry.getQuery("inference.voices")).isPresent();
        assertThatThrownBy(() -> module.resourceFactories().get(0).create("asms://inference/engines"))
            .satisfies(e -> assertThat(UnitException.isNotFound(e)).isTrue());
    }

    @Test
    void 모델_수가_바뀌면_models_changed() throws InterruptedException {
        // given
        CallContext ctx = CallContext.background().withCancel();
        ResourceWatch watch = module.resources().get(0).watch(ctx);
        assertThat(watch.poll(2, TimeUnit.SECONDS).operation()).isEqualTo(ResourceOperation.REFRESH);

        // when
        provider.addModel(InferenceModel.of("yolov8", "YOLOv8", ModelType.DETECTION, "local", 0));

        // then
        ResourceUpdate changed = nextNonRefresh(watch);
        assertThat(changed.operation()).isEqualTo(ResourceOperation.MODELS_CHANGED);
        assertThat(changed.uri()).isEqualTo(InferenceModelsResource.URI);
        ctx.cancel();
    }

    private static ResourceUpdate nextNonRefresh(ResourceWatch watch) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
        while (System.nanoTime() < deadline) {
            ResourceUpdate update = watch.poll(100, TimeUnit.MILLISECONDS);
            if (update != null && update.operation() != ResourceOperation.REFRESH) {
                return update;
            }
        }
        throw new AssertionError("no change observed");
    }
}
