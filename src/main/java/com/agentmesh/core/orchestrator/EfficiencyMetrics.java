package com.agentmesh.core.orchestrator;

/**
 * Running totals of processed tasks by complexity type.
 */
public record EfficiencyMetrics(
    long totalTasks,
    long simpleTasks,
    long moderateTasks,
    long complexTasks,
    double averageAgentsPerTask
) {}
