/**
 * Durable write outcome package.
 *
 * <p>This package defines the sealed interface hierarchy returned by a durable state write.
 * A rejected save is never thrown; it is reported as a {@code RolledBack} value.</p>
 *
 * <h2>Outcome Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.statekeeper.core.outcome.Committed} - State written and persisted</li>
 *   <li>{@link com.ryuqq.statekeeper.core.outcome.RolledBack} - Store rejected the save, previous raw value restored</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Statekeeper Team
 */
package com.ryuqq.statekeeper.core.outcome;
