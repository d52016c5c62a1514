package com.agentmesh.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Hands the process arguments to picocli and keeps its exit code for Spring Boot.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final AgentMeshCommand agentMeshCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(AgentMeshCommand agentMeshCommand, IFactory factory) {
        this.agentMeshCommand = agentMeshCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        exitCode = new CommandLine(agentMeshCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
