package com.agentmesh.core.orchestrator;

import com.agentmesh.core.model.Task;

/**
 * Assignment of one subtask to a worker.
 *
 * @param subtask the subtask
 * @param agentId chosen worker, or null when none was available
 * @param score   delegation score of the chosen worker (0 for the least-loaded fallback)
 */
public record Delegation(Task subtask, String agentId, double score) {

    public static Delegation unassigned(Task subtask) {
        return new Delegation(subtask, null, 0.0);
    }

    public boolean isAssigned() {
        return agentId != null;
    }
}
