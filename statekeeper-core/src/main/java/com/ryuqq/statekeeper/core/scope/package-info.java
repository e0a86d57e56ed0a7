/**
 * Query-by-state entry points.
 *
 * <p>{@link com.ryuqq.statekeeper.core.scope.StateScopeRegistry} registers one
 * {@link com.ryuqq.statekeeper.core.scope.StateScope} per declared state, checked against
 * existing names at setup time.</p>
 *
 * @since 1.0.0
 * @author Statekeeper Team
 */
package com.ryuqq.statekeeper.core.scope;
