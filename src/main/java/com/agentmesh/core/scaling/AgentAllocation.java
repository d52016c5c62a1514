package com.agentmesh.core.scaling;

/**
 * Recommended budget for a task.
 *
 * @param agentCount        number of agents to involve
 * @param toolCallsPerAgent tool-call budget for each of them
 * @param level             complexity level the budget was derived from
 */
public record AgentAllocation(int agentCount, int toolCallsPerAgent, ComplexityLevel level) {}
