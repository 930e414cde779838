package com.ryuqq.asms.domain.device;

import com.ryuqq.asms.core.context.CallContext;
import com.ryuqq.asms.core.contract.Resource;
import com.ryuqq.asms.core.contract.ResourceOperation;
import com.ryuqq.asms.core.error.UnitException;
import com.ryuqq.asms.core.event.EventPublisher;
import com.ryuqq.asms.domain.support.DomainEvents;
import com.ryuqq.asms.runtime.watch.AbstractPollingResource;
import com.ryuqq.asms.runtime.watch.ChangeDetector;
import com.ryuqq.asms.runtime.watch.ResourcePoller;
import com.ryuqq.asms.runtime.watch.WatchConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * 장치별 Resource 구현.
 *
 * <p><strong>poll 주기와 알림 종류:</strong></p>
 * <ul>
 *   <li>info - 30s, 항상 refresh</li>
 *   <li>metrics - 5s, 항상 update</li>
 *   <li>health - 10s, status가 바뀌면 health_changed (+ device.health_changed 발행), 아니면 refresh</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DeviceResources {

    private static final Logger log = LoggerFactory.getLogger(DeviceResources.class);

    private final DeviceProvider provider;
    private final ResourcePoller poller;
    private final WatchConfig config;
    private final EventPublisher publisher;
    private final Clock clock;

    public DeviceResources(
        DeviceProvider provider,
        ResourcePoller poller,
        WatchConfig config,
        EventPublisher publisher,
        Clock clock
    ) {
        if (poller == null) {
            throw new IllegalArgumentException("poller cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.provider = provider;
        this.poller = poller;
        this.config = config;
        this.publisher = EventPublisher.orNoop(publisher);
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public Resource create(DeviceResourceUri uri) {
        return switch (uri.type()) {
            case INFO -> new InfoResource(uri);
            case METRICS -> new MetricsResource(uri);
            case HEALTH -> new HealthResource(uri);
        };
    }

    public Resource info(String deviceId) {
        return create(DeviceResourceUri.of(DeviceResourceType.INFO, deviceId));
    }

    public Resource metrics(String deviceId) {
        return create(DeviceResourceUri.of(DeviceResourceType.METRICS, deviceId));
    }

    public Resource health(String deviceId) {
        return create(DeviceResourceUri.of(DeviceResourceType.HEALTH, deviceId));
    }

    private final class InfoResource extends AbstractPollingResource {

        private final String deviceId;

        InfoResource(DeviceResourceUri uri) {
            super(uri.toUri(), DeviceEvents.DOMAIN, DeviceQueries.INFO_SCHEMA, poller, config.deviceInfoIntervalMs(),
                config.bufferCapacity());
            this.deviceId = uri.deviceId();
        }

        @Override
        public Object get(CallContext ctx) {
            DeviceProvider p = DeviceCommands.requireProvider(provider);
            try {
                return DeviceViews.info(p.getDevice(ctx, deviceId));
            } catch (UnitException e) {
                throw UnitException.wrap("get device " + deviceId + " info", e);
            }
        }

        @Override
        protected ChangeDetector newChangeDetector() {
            return ChangeDetector.always(ResourceOperation.REFRESH);
        }
    }

    private final class MetricsResource extends AbstractPollingResource {

        private final String deviceId;

        MetricsResource(DeviceResourceUri uri) {
            super(uri.toUri(), DeviceEvents.DOMAIN, DeviceQueries.METRICS_SCHEMA, poller,
                config.deviceMetricsIntervalMs(), config.bufferCapacity());
            this.deviceId = uri.deviceId();
        }

        @Override
        public Object get(CallContext ctx) {
            DeviceProvider p = DeviceCommands.requireProvider(provider);
            try {
                return DeviceViews.metrics(p.getMetrics(ctx, deviceId));
            } catch (UnitException e) {
                throw UnitException.wrap("get device " + deviceId + " metrics", e);
            }
        }

        @Override
        protected ChangeDetector newChangeDetector() {
            return ChangeDetector.always(ResourceOperation.UPDATE);
        }
    }

    private final class HealthResource extends AbstractPollingResource {

        private final String deviceId;

        HealthResource(DeviceResourceUri uri) {
            super(uri.toUri(), DeviceEvents.DOMAIN, DeviceQueries.HEALTH_SCHEMA, poller,
                config.deviceHealthIntervalMs(), config.bufferCapacity());
            this.deviceId = uri.deviceId();
        }

        @Override
        public Object get(CallContext ctx) {
            DeviceProvider p = DeviceCommands.requireProvider(provider);
            try {
                return DeviceViews.health(p.getHealth(ctx, deviceId));
            } catch (UnitException e) {
                throw UnitException.wrap("get device " + deviceId + " health", e);
            }
        }

        @Override
        protected ChangeDetector newChangeDetector() {
            return ChangeDetector.onFieldChange("status", ResourceOperation.HEALTH_CHANGED, (previous, current) -> {
                log.info("Device {} health changed: {} -> {}", deviceId, previous, current);
                DomainEvents.publish(publisher, DeviceEvents.healthChanged(
                    deviceId, String.valueOf(previous), String.valueOf(current), clock));
            });
        }
    }
}
