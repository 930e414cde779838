/**
 * Alert domain: rules, alerts and their lifecycle.
 *
 * <h2>Units</h2>
 * <ul>
 *   <li>Commands: {@code alert.create_rule}, {@code alert.update_rule}, {@code alert.delete_rule},
 *       {@code alert.acknowledge}, {@code alert.resolve}</li>
 *   <li>Queries: {@code alert.list_rules}, {@code alert.history}, {@code alert.active}</li>
 * </ul>
 *
 * <h2>Resources</h2>
 * <ul>
 *   <li>{@code asms://alerts/rules} - refresh on every tick</li>
 *   <li>{@code asms://alerts/active} - update on every tick</li>
 * </ul>
 *
 * <h2>Lifecycle</h2>
 * <p>An alert enters as {@code firing}; {@code acknowledge} moves it to {@code acknowledged};
 * {@code resolve} moves any state to {@code resolved}. Active means firing or acknowledged.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.asms.domain.alert;
