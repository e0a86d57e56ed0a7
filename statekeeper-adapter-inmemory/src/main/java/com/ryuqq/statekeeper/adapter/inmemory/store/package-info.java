/**
 * In-memory Store adapter implementation package.
 *
 * <p>This package provides a reference document store for tests and examples.</p>
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.statekeeper.adapter.inmemory.store.InMemoryDocumentStore}:
 *       Thread-safe implementation of {@link com.ryuqq.statekeeper.core.spi.Store}</li>
 *   <li>{@link com.ryuqq.statekeeper.adapter.inmemory.store.InMemoryDocument}:
 *       {@link com.ryuqq.statekeeper.core.spi.Record} with reload support</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>No transaction or locking support</li>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * @see com.ryuqq.statekeeper.core.spi.Store
 * @author Statekeeper Team
 * @since 1.0.0
 */
package com.ryuqq.statekeeper.adapter.inmemory.store;
