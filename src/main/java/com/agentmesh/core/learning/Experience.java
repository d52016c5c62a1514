package com.agentmesh.core.learning;

import java.util.Map;

/**
 * One observed transition.
 *
 * @param state     state the action was taken in
 * @param action    action taken
 * @param reward    reward received
 * @param nextState resulting state (ignored when terminal)
 * @param terminal  whether the episode ended with this transition
 */
public record Experience(
    Map<String, ?> state,
    String action,
    double reward,
    Map<String, ?> nextState,
    boolean terminal
) {

    public Experience {
        state = state != null ? state : Map.of();
        nextState = nextState != null ? nextState : Map.of();
    }

    public static Experience terminal(Map<String, ?> state, String action, double reward) {
        return new Experience(state, action, reward, Map.of(), true);
    }
}
