/**
 * Device domain: read-only hardware inventory behind a {@link com.ryuqq.asms.domain.device.DeviceProvider}.
 *
 * <h2>Units</h2>
 * <ul>
 *   <li>Commands: {@code device.detect}, {@code device.set_power_limit}</li>
 *   <li>Queries: {@code device.info}, {@code device.metrics}, {@code device.health}</li>
 * </ul>
 *
 * <h2>Resources</h2>
 * <p>{@code asms://device/<deviceId>/{info|metrics|health}}, created on demand by
 * {@link com.ryuqq.asms.domain.device.DeviceResourceFactory}.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.asms.domain.device;
