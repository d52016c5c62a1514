package com.agentmesh.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command. Routes to subcommands: run, agents, health.
 */
@Command(
        name = "agentmesh",
        mixinStandardHelpOptions = true,
        version = "AgentMesh 0.1.0",
        description = "Multi-agent task orchestration",
        subcommands = {
                RunCommand.class,
                AgentsCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class AgentMeshCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
