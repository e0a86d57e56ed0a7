/**
 * State coordinator package.
 *
 * <p>{@link com.ryuqq.statekeeper.application.coordinator.StateCoordinator} is the entry
 * point an FSM engine calls when an event fires: it reads the current state, ensures an
 * initial state before validation, and commits a target state durably or deferred.</p>
 *
 * <h2>Event Integration</h2>
 * <pre>
 * FSM engine                         StateCoordinator
 * ----------                         ----------------
 * guards pass
 *   hard event (close!)   ───────►   writeDurable(record, closed, store)
 *                         ◄───────   Committed | RolledBack(previous)
 *   Committed → after callbacks
 *   soft event (close)    ───────►   writeDeferred(record, closed)
 * </pre>
 *
 * @since 1.0.0
 * @author Statekeeper Team
 */
package com.ryuqq.statekeeper.application.coordinator;
