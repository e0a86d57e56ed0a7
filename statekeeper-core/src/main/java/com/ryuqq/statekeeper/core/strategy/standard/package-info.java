/**
 * Standard strategy implementations package.
 *
 * <p>These implementations are used by the coordinator for every strategy the host does
 * not replace.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.statekeeper.core.strategy.standard.StandardReadStateStrategy}</li>
 *   <li>{@link com.ryuqq.statekeeper.core.strategy.standard.StandardInitialStateStrategy}</li>
 *   <li>{@link com.ryuqq.statekeeper.core.strategy.standard.StandardDurableWriteStrategy}</li>
 *   <li>{@link com.ryuqq.statekeeper.core.strategy.standard.StandardDeferredWriteStrategy}</li>
 * </ul>
 *
 * <p>All implementations are stateless apart from their configuration and may be shared
 * across threads.</p>
 *
 * @since 1.0.0
 * @author Statekeeper Team
 */
package com.ryuqq.statekeeper.core.strategy.standard;
