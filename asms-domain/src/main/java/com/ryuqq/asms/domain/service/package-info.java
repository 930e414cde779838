/**
 * Service domain: lifecycle of model inference services backed by a
 * {@link com.ryuqq.asms.domain.service.ServiceProvider} and persisted in a
 * {@link com.ryuqq.asms.domain.service.ServiceStore}.
 *
 * <h2>Units</h2>
 * <ul>
 *   <li>Commands: {@code service.create}, {@code service.delete}, {@code service.scale},
 *       {@code service.start}, {@code service.stop}</li>
 *   <li>Queries: {@code service.get}, {@code service.list}, {@code service.status},
 *       {@code service.recommend}</li>
 * </ul>
 *
 * <h2>Lifecycle</h2>
 * <p>Services are created {@code pending}. Start moves through {@code starting} to {@code running},
 * or to {@code failed} when the provider fails. Stop moves through {@code stopping} to
 * {@code stopped}. Every transition publishes a {@code service.*} domain event.</p>
 *
 * <h2>Resources</h2>
 * <ul>
 *   <li>{@code asms://service/<id>} - polled every 30 seconds, emits {@code status_changed}</li>
 *   <li>{@code asms://services} - polled every 60 seconds, always {@code refresh}</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.asms.domain.service;
