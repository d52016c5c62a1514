package com.agentmesh.core.model;

/**
 * Coarse status recorded alongside a task in the task store.
 */
public enum TaskStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED
}
