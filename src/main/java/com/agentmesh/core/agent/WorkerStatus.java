package com.agentmesh.core.agent;

import java.util.List;

/**
 * Point-in-time view of one worker, as shown by {@code agentmesh agents}.
 */
public record WorkerStatus(
    String agentId,
    String agentType,
    List<String> capabilities,
    boolean busy,
    long completed,
    long failed,
    double successRate,
    double performanceScore,
    int queuedMessages
) {}
