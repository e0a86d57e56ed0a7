/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the collaborators the coordinator consumes. Surrounding code
 * (document mappers, FSM engines, validation frameworks) provides the implementations.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.statekeeper.core.spi.Record} - Entity handle with raw field access</li>
 *   <li>{@link com.ryuqq.statekeeper.core.spi.Store} - Durable save with optional validation bypass</li>
 *   <li>{@link com.ryuqq.statekeeper.core.spi.InitialStateSupplier} - FSM initial state computation</li>
 *   <li>{@link com.ryuqq.statekeeper.core.spi.Validator} - Record validation rules</li>
 * </ul>
 *
 * <h2>Error Taxonomy</h2>
 * <ul>
 *   <li><strong>PersistenceRejected:</strong> {@code false} from persist, or
 *       {@link com.ryuqq.statekeeper.core.spi.PersistenceRejectedException}; recovered by rollback</li>
 *   <li><strong>CollaboratorFault:</strong> any other runtime exception; propagated to the caller</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Dependency Inversion:</strong> Core does not depend on any document store</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Statekeeper Team
 */
package com.ryuqq.statekeeper.core.spi;
