package com.agentmesh.core.bus;

import java.util.Map;

/**
 * Snapshot of message bus counters.
 */
public record BusStatistics(
    long totalMessages,
    long broadcasts,
    long directMessages,
    long dropped,
    long expired,
    int registeredAgents,
    int pendingResponses,
    Map<String, Integer> queueSizes
) {}
