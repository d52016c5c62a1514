package com.agentmesh.core.orchestrator;

import com.agentmesh.core.agent.WorkerPool;
import com.agentmesh.core.agent.WorkerRuntime;
import com.agentmesh.core.model.Task;
import com.agentmesh.core.scaling.LoadBalancer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Chooses a worker for each subtask among the workers that are running and not busy.
 * <p>
 * A worker scores the sum of its proficiencies for the subtask's requirements, times its
 * performance score and success rate. The highest score wins and ties go to the worker
 * registered first. When every score is zero, the least-loaded idle worker takes the subtask.
 */
public class DelegationPlanner {

    private static final Logger log = LoggerFactory.getLogger(DelegationPlanner.class);

    private final WorkerPool workerPool;
    private final LoadBalancer loadBalancer;

    public DelegationPlanner(WorkerPool workerPool, LoadBalancer loadBalancer) {
        this.workerPool = workerPool;
        this.loadBalancer = loadBalancer;
    }

    public List<Delegation> plan(List<Task> subtasks) {
        var delegations = new ArrayList<Delegation>(subtasks.size());
        for (Task subtask : subtasks) {
            delegations.add(delegate(subtask, workerPool.idleWorkers()));
        }
        return delegations;
    }

    Delegation delegate(Task subtask, List<WorkerRuntime> candidates) {
        if (candidates.isEmpty()) {
            log.warn("No idle worker for subtask {}", subtask.id());
            return Delegation.unassigned(subtask);
        }
        WorkerRuntime best = null;
        double bestScore = 0.0;
        for (WorkerRuntime candidate : candidates) {
            double s = score(candidate, subtask);
            log.debug("Subtask {}: {} scores {}", subtask.id(), candidate.agentId(), s);
            if (s > bestScore) {
                best = candidate;
                bestScore = s;
            }
        }
        if (best != null) {
            return new Delegation(subtask, best.agentId(), bestScore);
        }
        String fallback = loadBalancer.leastLoadedAgent(candidates.stream().map(WorkerRuntime::agentId).toList())
                .orElseThrow();
        log.debug("Subtask {}: no capability match, least-loaded worker {} takes it", subtask.id(), fallback);
        return new Delegation(subtask, fallback, 0.0);
    }

    static double score(WorkerRuntime worker, Task subtask) {
        double proficiency = 0.0;
        for (String requirement : subtask.requirements()) {
            proficiency += worker.agent().proficiency(requirement);
        }
        return proficiency * worker.performanceScore() * worker.successRate();
    }
}
