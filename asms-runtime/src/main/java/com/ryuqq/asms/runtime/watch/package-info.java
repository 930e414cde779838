/**
 * Polling-based resource watch runtime.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.asms.runtime.watch.ResourcePoller} - Scheduled ticks with error updates and cancellation</li>
 *   <li>{@link com.ryuqq.asms.runtime.watch.ChangeDetector} - Chooses the operation of each successful tick</li>
 *   <li>{@link com.ryuqq.asms.runtime.watch.WatcherList} - Shared poll fanned out to several subscribers</li>
 *   <li>{@link com.ryuqq.asms.runtime.watch.QueueResourceWatch} - Bounded, drop-when-full subscriber buffer</li>
 * </ul>
 *
 * <h2>Slow Consumers</h2>
 * <p>Delivery never blocks the scheduler. A full buffer drops the new update and logs a warning.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.asms.runtime.watch;
