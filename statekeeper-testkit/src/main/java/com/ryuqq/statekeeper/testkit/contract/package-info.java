/**
 * Contract test fixtures.
 *
 * <ul>
 *   <li>{@link com.ryuqq.statekeeper.testkit.contract.AbstractContractTest} - Base class with overridable collaborator factories</li>
 *   <li>{@link com.ryuqq.statekeeper.testkit.contract.ScriptedStore} - Store with scripted responses and call recording</li>
 *   <li>{@link com.ryuqq.statekeeper.testkit.contract.MapRecord} - Map-backed record with reload</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Statekeeper Team
 */
package com.ryuqq.statekeeper.testkit.contract;
