package com.agentmesh.core.persistence;

import com.agentmesh.core.model.Result;
import com.agentmesh.core.model.Task;
import com.agentmesh.core.model.TaskStatus;

import java.util.List;

/**
 * Outbound persistence of task history. The orchestrator treats every call as fire-and-forget:
 * failures are logged, never retried.
 */
public interface TaskStore {

    void saveTask(Task task);

    void saveResult(Result result);

    /**
     * Most recent tasks first.
     *
     * @param status only tasks in this status, or null for all
     * @param limit  maximum number of records
     */
    List<TaskRecord> queryTasks(TaskStatus status, int limit);
}
