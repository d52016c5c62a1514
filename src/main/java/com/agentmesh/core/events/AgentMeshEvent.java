package com.agentmesh.core.events;

import java.time.Instant;
import java.util.Map;

/**
 * A lifecycle event emitted while a task moves through the orchestrator.
 *
 * @param eventType event type (e.g. "task.received", "subtask.completed", "task.synthesized")
 * @param taskId    the top-level task this event belongs to
 * @param subtaskId the subtask this event relates to (nullable for task-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record AgentMeshEvent(
    String eventType,
    String taskId,
    String subtaskId,
    Map<String, Object> payload,
    Instant timestamp
) {

    public static final String TASK_RECEIVED = "task.received";
    public static final String TASK_ANALYZED = "task.analyzed";
    public static final String TASK_DECOMPOSED = "task.decomposed";
    public static final String TASK_DELEGATED = "task.delegated";
    public static final String SUBTASK_STARTED = "subtask.started";
    public static final String SUBTASK_COMPLETED = "subtask.completed";
    public static final String TASK_SYNTHESIZED = "task.synthesized";

    public static AgentMeshEvent of(String eventType, String taskId, Map<String, Object> payload) {
        return new AgentMeshEvent(eventType, taskId, null, payload, Instant.now());
    }

    public static AgentMeshEvent forSubtask(String eventType, String taskId, String subtaskId,
                                            Map<String, Object> payload) {
        return new AgentMeshEvent(eventType, taskId, subtaskId, payload, Instant.now());
    }
}
