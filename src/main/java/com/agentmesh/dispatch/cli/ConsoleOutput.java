package com.agentmesh.dispatch.cli;

import com.agentmesh.core.agent.WorkerStatus;
import com.agentmesh.core.events.AgentMeshEvent;
import com.agentmesh.core.model.SubtaskSummary;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output for the AgentMesh CLI.
 */
public class ConsoleOutput {

    static final String RULE = "──────────────────────────────────";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) AGENTMESH v0.1.0|@"));
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [AGENTMESH]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void subtask(SubtaskSummary summary) {
        String status = summary.success() ? "@|fg(green) PASS|@" : "@|fg(red) FAIL|@";
        String detail = summary.success()
                ? String.format("quality %.2f", summary.qualityScore())
                : summary.error();
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(blue) [" + summary.agentId() + "]|@ " + status + " " + summary.taskId()
                + ": " + detail + " (" + summary.executionTimeMs() + "ms)"));
    }

    public static void worker(WorkerStatus status) {
        String state = status.busy() ? "@|fg(yellow) busy|@" : "@|fg(green) idle|@";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(
                "  @|bold %-12s|@ %-18s %s  done %d, failed %d, success %.0f%%, perf %.2f, queued %d",
                status.agentId(), status.agentType(), state, status.completed(), status.failed(),
                status.successRate() * 100, status.performanceScore(), status.queuedMessages())));
        System.out.println("      capabilities: " + String.join(", ", status.capabilities()));
    }

    public static void event(AgentMeshEvent event) {
        String prefix = switch (event.eventType()) {
            case "task.received", "task.analyzed", "task.decomposed", "task.delegated" ->
                    "@|fg(cyan) [" + event.eventType() + "]|@";
            case "subtask.started", "subtask.completed" -> "@|fg(blue) [" + event.eventType() + "]|@";
            case "task.synthesized" -> "@|fg(green),bold [" + event.eventType() + "]|@";
            default -> "@|fg(white) [" + event.eventType() + "]|@";
        };
        String subject = event.subtaskId() != null ? event.subtaskId() : event.taskId();
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + subject + " " + event.payload()));
    }
}
