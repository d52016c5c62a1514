package com.agentmesh.core.scaling;

/**
 * Complexity buckets with the agent and tool-call budgets recommended for each.
 */
public enum ComplexityLevel {
    SIMPLE(1, 10),
    MODERATE(4, 15),
    COMPLEX(8, 20),
    VERY_COMPLEX(15, 25);

    private final int maxAgents;
    private final int toolCallsPerAgent;

    ComplexityLevel(int maxAgents, int toolCallsPerAgent) {
        this.maxAgents = maxAgents;
        this.toolCallsPerAgent = toolCallsPerAgent;
    }

    public int maxAgents() {
        return maxAgents;
    }

    public int toolCallsPerAgent() {
        return toolCallsPerAgent;
    }

    /** Buckets a raw score: at most 2 simple, 6 moderate, 12 complex, above that very complex. */
    public static ComplexityLevel fromScore(double score) {
        if (score <= 2.0) return SIMPLE;
        if (score <= 6.0) return MODERATE;
        if (score <= 12.0) return COMPLEX;
        return VERY_COMPLEX;
    }
}
