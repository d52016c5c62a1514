package com.agentmesh.core.scaling;

import com.agentmesh.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Classifies task complexity and derives agent, tool-call and decomposition budgets from it.
 * <p>
 * Stateless; safe to share.
 */
public class ScalingStrategy {

    private static final Logger log = LoggerFactory.getLogger(ScalingStrategy.class);

    static final double REQUIREMENT_WEIGHT = 2.0;
    static final double SUBTASK_WEIGHT = 1.5;
    static final double CONTEXT_WEIGHT = 0.5;
    static final double HIGH_PRIORITY_BONUS = 1.0;
    static final int HIGH_PRIORITY = 8;

    static final int MEDIUM_DESCRIPTION = 200;
    static final int LONG_DESCRIPTION = 500;

    public ComplexityAssessment assessComplexity(Task task) {
        double score = REQUIREMENT_WEIGHT * task.requirements().size()
                + lengthBonus(task.description())
                + SUBTASK_WEIGHT * task.childTaskIds().size()
                + (task.priority() >= HIGH_PRIORITY ? HIGH_PRIORITY_BONUS : 0.0)
                + CONTEXT_WEIGHT * task.context().size();
        var level = ComplexityLevel.fromScore(score);
        log.debug("Task {} complexity score {} ({})", task.id(), score, level);
        return new ComplexityAssessment(score, level);
    }

    private static double lengthBonus(String description) {
        int length = description.length();
        if (length > LONG_DESCRIPTION) return 3.0;
        if (length > MEDIUM_DESCRIPTION) return 1.5;
        return 0.0;
    }

    /**
     * Recommends how many agents to involve. The count never exceeds {@code availableAgents}
     * nor the number of requirements (at least one), and is at least 1 whenever an agent is
     * available.
     */
    public AgentAllocation getAgentAllocation(Task task, int availableAgents) {
        var level = assessComplexity(task).level();
        int count = Math.min(level.maxAgents(), Math.max(1, task.requirements().size()));
        count = Math.min(count, Math.max(0, availableAgents));
        return new AgentAllocation(count, level.toolCallsPerAgent(), level);
    }

    public DecompositionPlan getDecompositionStrategy(Task task) {
        int requirements = task.requirements().size();
        return switch (assessComplexity(task).level()) {
            case SIMPLE -> DecompositionPlan.none();
            case MODERATE -> new DecompositionPlan(true, DecompositionMethod.REQUIREMENT_BASED,
                    Math.min(Math.max(2, requirements), 4));
            case COMPLEX -> new DecompositionPlan(true, DecompositionMethod.HIERARCHICAL,
                    Math.min(Math.max(requirements, 4), 8));
            case VERY_COMPLEX -> new DecompositionPlan(true, DecompositionMethod.DIVIDE_AND_CONQUER,
                    Math.min(Math.max(requirements, 8), 15));
        };
    }
}
