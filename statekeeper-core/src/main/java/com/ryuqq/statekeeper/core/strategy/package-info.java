/**
 * State write strategy package.
 *
 * <p>Each coordinator operation is backed by an independently replaceable strategy, so a
 * host application can override one operation (for example a custom durable write)
 * without forking the others.</p>
 *
 * <h2>Strategy Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.statekeeper.core.strategy.ReadStateStrategy} - Fresh read of the state field</li>
 *   <li>{@link com.ryuqq.statekeeper.core.strategy.InitialStateStrategy} - Populate a blank field before validation</li>
 *   <li>{@link com.ryuqq.statekeeper.core.strategy.DurableWriteStrategy} - Write, persist, roll back on rejection</li>
 *   <li>{@link com.ryuqq.statekeeper.core.strategy.DeferredWriteStrategy} - In-memory write only</li>
 * </ul>
 *
 * <h2>Standard Implementations</h2>
 * <p>See {@link com.ryuqq.statekeeper.core.strategy.standard}.</p>
 *
 * @since 1.0.0
 * @author Statekeeper Team
 */
package com.ryuqq.statekeeper.core.strategy;
