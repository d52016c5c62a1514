package com.agentmesh.core.fallback;

/**
 * How a chain picks alternatives once the primary operation has failed.
 */
public enum FallbackStrategy {
    /** Try options in priority order until one succeeds. */
    SEQUENTIAL,
    /** Run all options at once, keep the first success, cancel the rest. */
    PARALLEL,
    /** Draw one option by weight; on failure continue sequentially over the remainder. */
    WEIGHTED,
    /** Try options ordered by observed success rate and latency. */
    ADAPTIVE
}
