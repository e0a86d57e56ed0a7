/**
 * Domain model package.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.statekeeper.core.model.StateField} - Name of the attribute holding the persisted state</li>
 *   <li>{@link com.ryuqq.statekeeper.core.model.State} - Opaque state label with the blank sentinel</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> All value objects are immutable</li>
 *   <li><strong>Validation:</strong> Invalid field names are rejected at construction time</li>
 *   <li><strong>Opacity:</strong> State membership is decided by the FSM engine, not here</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Statekeeper Team
 */
package com.ryuqq.statekeeper.core.model;
