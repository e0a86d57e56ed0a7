/**
 * Coordinator configuration package.
 *
 * <ul>
 *   <li>{@link com.ryuqq.statekeeper.core.config.CoordinatorConfig} - State field and fault policy per entity type</li>
 *   <li>{@link com.ryuqq.statekeeper.core.config.FaultPolicy} - In-memory behaviour when the store raises</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Statekeeper Team
 */
package com.ryuqq.statekeeper.core.config;
