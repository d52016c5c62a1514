package com.agentmesh.core.model;

/**
 * Per-subtask detail carried in a synthesized result's payload.
 */
public record SubtaskSummary(
    String taskId,
    String agentId,
    boolean success,
    double qualityScore,
    long executionTimeMs,
    Object payload,
    String error
) {

    public static SubtaskSummary from(Result result) {
        return new SubtaskSummary(result.taskId(), result.agentId(), result.success(),
                result.qualityScore(), result.executionTime().toMillis(), result.payload(), result.error());
    }
}
