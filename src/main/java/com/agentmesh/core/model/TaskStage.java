package com.agentmesh.core.model;

/**
 * Position of a task in the orchestrator's processing pipeline.
 */
public enum TaskStage {
    RECEIVED,
    ANALYZED,
    DECOMPOSED,
    NOT_DECOMPOSED,
    DELEGATED,
    EXECUTING,
    SYNTHESIZED
}
