package com.agentmesh.core.scaling;

/**
 * @param shouldDecompose whether the task should be split at all
 * @param method          how to split it
 * @param targetSubtasks  recommended number of subtasks (1 when not decomposing)
 */
public record DecompositionPlan(boolean shouldDecompose, DecompositionMethod method, int targetSubtasks) {

    public static DecompositionPlan none() {
        return new DecompositionPlan(false, DecompositionMethod.NONE, 1);
    }
}
