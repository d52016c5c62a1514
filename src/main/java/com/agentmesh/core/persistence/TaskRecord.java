package com.agentmesh.core.persistence;

import com.agentmesh.core.model.Result;
import com.agentmesh.core.model.Task;
import com.agentmesh.core.model.TaskStatus;

/**
 * A stored task with its latest status and, once finished, its result.
 */
public record TaskRecord(Task task, TaskStatus status, Result result) {}
