package com.agentmesh.core.orchestrator;

import com.agentmesh.core.scaling.AgentAllocation;
import com.agentmesh.core.scaling.ComplexityAssessment;
import com.agentmesh.core.scaling.DecompositionPlan;

import java.util.Map;

/**
 * Result of analysing a task before decomposition.
 *
 * @param score             complexity between 0 and 1
 * @param type              bucket of {@code score}
 * @param indicators        match counts per complexity indicator
 * @param estimatedAgents   agents the task is expected to need
 * @param parallelPotential comparison plus multiple-topic matches
 * @param assessment        weighted score from the scaling strategy
 * @param allocation        agent and tool-call budget from the scaling strategy
 * @param plan              decomposition recommended by the scaling strategy
 */
public record TaskAnalysis(
    double score,
    ComplexityType type,
    Map<String, Integer> indicators,
    int estimatedAgents,
    int parallelPotential,
    ComplexityAssessment assessment,
    AgentAllocation allocation,
    DecompositionPlan plan
) {

    public int totalIndicators() {
        return indicators.values().stream().mapToInt(Integer::intValue).sum();
    }
}
