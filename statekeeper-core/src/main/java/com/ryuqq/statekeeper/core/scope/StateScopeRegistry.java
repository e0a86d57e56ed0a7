package com.ryuqq.statekeeper.core.scope;

import com.ryuqq.statekeeper.core.model.State;
import com.ryuqq.statekeeper.core.model.StateField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Builds one {@link StateScope} per declared state at setup time.
 *
 * <p><strong>Collision Rule:</strong> a state whose name is already taken by an existing
 * entry point (or by a scope registered earlier in the same call) is skipped and never
 * overwrites it.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * Map&lt;String, StateScope&gt; scopes = StateScopeRegistry.register(
 *     StateField.of("state"),
 *     List.of(State.of("pending"), State.of("opened"), State.of("closed")),
 *     Set.of("all", "closed"));
 *
 * scopes.keySet(); // [pending, opened] - "closed" collides with an existing entry point
 * </pre>
 *
 * @author Statekeeper Team
 * @since 1.0.0
 */
public final class StateScopeRegistry {

    private static final Logger log = LoggerFactory.getLogger(StateScopeRegistry.class);

    // Utility class - prevent instantiation
    private StateScopeRegistry() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Registers scopes for the declared states.
     *
     * @param field the state field
     * @param declaredStates the states declared by the FSM, in declaration order
     * @param existingNames entry point names already defined on the host
     * @return scopes by name, in declaration order (unmodifiable)
     * @throws IllegalArgumentException if any argument is null, or a declared state is blank
     */
    public static Map<String, StateScope> register(StateField field,
                                                   Collection<State> declaredStates,
                                                   Set<String> existingNames) {
        if (field == null) {
            throw new IllegalArgumentException("field cannot be null");
        }
        if (declaredStates == null) {
            throw new IllegalArgumentException("declaredStates cannot be null");
        }
        if (existingNames == null) {
            throw new IllegalArgumentException("existingNames cannot be null");
        }

        Map<String, StateScope> scopes = new LinkedHashMap<>();
        for (State state : declaredStates) {
            if (state == null || state.isBlank()) {
                throw new IllegalArgumentException("declared state cannot be null or blank");
            }
            String name = state.value();
            if (existingNames.contains(name) || scopes.containsKey(name)) {
                log.debug("Scope {} not registered: name already defined", name);
                continue;
            }
            scopes.put(name, new StateScope(name, field, state));
        }
        return Collections.unmodifiableMap(scopes);
    }
}
