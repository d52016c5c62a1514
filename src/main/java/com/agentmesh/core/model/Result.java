package com.agentmesh.core.model;

import java.time.Duration;
import java.util.Map;

/**
 * Outcome of one processed task. Created exactly once per task and never modified.
 *
 * @param taskId        the task this result belongs to
 * @param success       whether the task succeeded
 * @param payload       agent-specific output (nullable)
 * @param error         failure description (null on success)
 * @param agentId       agent that produced the result
 * @param executionTime wall-clock time spent
 * @param qualityScore  self-reported quality between 0 and 1
 * @param metadata      additional key-value data
 */
public record Result(
    String taskId,
    boolean success,
    Object payload,
    String error,
    String agentId,
    Duration executionTime,
    double qualityScore,
    Map<String, Object> metadata
) {

    public Result {
        executionTime = executionTime != null ? executionTime : Duration.ZERO;
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
        if (qualityScore < 0.0 || qualityScore > 1.0) {
            qualityScore = Math.max(0.0, Math.min(1.0, qualityScore));
        }
    }

    public static Result success(String taskId, String agentId, Object payload,
                                 Duration executionTime, double qualityScore) {
        return new Result(taskId, true, payload, null, agentId, executionTime, qualityScore, Map.of());
    }

    public static Result failure(String taskId, String agentId, String error, Duration executionTime) {
        return new Result(taskId, false, null, error, agentId, executionTime, 0.0, Map.of());
    }

    public Result withMetadata(Map<String, Object> extra) {
        var merged = new java.util.HashMap<>(metadata);
        merged.putAll(extra);
        return new Result(taskId, success, payload, error, agentId, executionTime, qualityScore, merged);
    }
}
