package com.agentmesh.core.agent;

import com.agentmesh.core.model.AgentCapability;
import com.agentmesh.core.model.Result;
import com.agentmesh.core.model.Task;

import java.util.List;

/**
 * A worker that can process tasks matching its declared capabilities.
 * <p>
 * Implementations hold no mutable state of their own beyond thread-safe collaborators, so a
 * {@link WorkerRuntime} can call {@link #processTask} from its own thread. Failures are
 * reported as unsuccessful {@link Result}s rather than thrown.
 */
public interface WorkerAgent {

    String agentId();

    List<AgentCapability> capabilities();

    Result processTask(Task task);

    /** Proficiency for the named capability (case-insensitive), 0 if not declared. */
    default double proficiency(String capabilityName) {
        for (AgentCapability capability : capabilities()) {
            if (capability.name().equalsIgnoreCase(capabilityName)) {
                return capability.proficiency();
            }
        }
        return 0.0;
    }

    /** Short label used in status reports. */
    default String agentType() {
        return getClass().getSimpleName();
    }
}
