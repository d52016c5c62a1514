package com.agentmesh.dispatch.cli;

import com.agentmesh.core.orchestrator.Orchestrator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: agentmesh agents
 * <p>
 * Lists the worker pool with per-worker counters, then the orchestrator's efficiency totals.
 */
@Command(name = "agents", mixinStandardHelpOptions = true, description = "Show worker status")
@Component
public class AgentsCommand implements Runnable {

    private final Orchestrator orchestrator;

    public AgentsCommand(Orchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        var workers = orchestrator.workerStatus();
        if (workers.isEmpty()) {
            ConsoleOutput.error("No workers registered");
            return;
        }
        ConsoleOutput.info(workers.size() + " worker(s)");
        workers.forEach(ConsoleOutput::worker);

        var metrics = orchestrator.efficiencyMetrics();
        System.out.println(ConsoleOutput.RULE);
        ConsoleOutput.info(String.format("Tasks: %d (simple %d, moderate %d, complex %d), %.1f agents per task",
                metrics.totalTasks(), metrics.simpleTasks(), metrics.moderateTasks(), metrics.complexTasks(),
                metrics.averageAgentsPerTask()));
    }
}
