/**
 * Record lifecycle pipeline package.
 *
 * <p>{@link com.ryuqq.statekeeper.application.lifecycle.RecordLifecycle} wires the
 * initial-state hook into a create/update pipeline as an explicit call made before
 * every validation attempt.</p>
 *
 * @since 1.0.0
 * @author Statekeeper Team
 */
package com.ryuqq.statekeeper.application.lifecycle;
