package com.agentmesh.dispatch.cli;

import com.agentmesh.core.agent.WorkerStatus;
import com.agentmesh.core.events.EventBus;
import com.agentmesh.core.health.HealthCheckService;
import com.agentmesh.core.health.HealthStatus;
import com.agentmesh.core.model.Result;
import com.agentmesh.core.model.SubtaskSummary;
import com.agentmesh.core.model.Task;
import com.agentmesh.core.model.TaskStatus;
import com.agentmesh.core.orchestrator.EfficiencyMetrics;
import com.agentmesh.core.orchestrator.Orchestrator;
import com.agentmesh.core.submission.TaskSubmissionService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Exercises the picocli command tree directly, without a Spring context.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private final TaskSubmissionService submissionService = mock(TaskSubmissionService.class);
    private final Orchestrator orchestrator = mock(Orchestrator.class);
    private final HealthCheckService healthCheckService = mock(HealthCheckService.class);
    private final EventBus eventBus = new EventBus();

    private CommandLine.IFactory createFactory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == RunCommand.class) {
                    return (K) new RunCommand(submissionService, eventBus);
                }
                if (cls == AgentsCommand.class) {
                    return (K) new AgentsCommand(orchestrator);
                }
                if (cls == HealthCommand.class) {
                    return (K) new HealthCommand(healthCheckService);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new AgentMeshCommand(), createFactory());
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private static Result synthesized(String taskId, boolean success) {
        var research = new SubtaskSummary("task-r", "research-1", true, 0.8, 12, "findings", null);
        var code = new SubtaskSummary("task-c", "code-1", success, success ? 0.6 : 0.0, 30, null,
                success ? null : "compiler crashed");
        return new Result(taskId, success, List.of(research, code), success ? null : "task-c: compiler crashed",
                Orchestrator.AGENT_ID, Duration.ofMillis(30), success ? 0.7 : 0.4, Map.of(
                        "outcome", success ? "SUCCEEDED" : "PARTIALLY_SUCCEEDED",
                        "complexity_type", "simple",
                        "complexity_score", 0.14,
                        "agents_used", List.of("research-1", "code-1")));
    }

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help lists all subcommands")
        void helpListsSubcommands() {
            var result = execute("--help");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("run"));
            assertTrue(result.output().contains("agents"));
            assertTrue(result.output().contains("health"));
        }

        @Test
        @DisplayName("--version prints the version")
        void version() {
            var result = execute("--version");
            assertTrue(result.output().contains("AgentMesh 0.1.0"));
        }

        @Test
        @DisplayName("no arguments prints banner and usage")
        void noArguments() {
            var result = execute();
            assertTrue(result.output().contains("AGENTMESH v0.1.0"));
            assertTrue(result.output().contains("Usage: agentmesh"));
        }
    }

    @Nested
    @DisplayName("run")
    class RunTests {

        @Test
        @DisplayName("submits the task with parsed options and prints the synthesized result")
        void runsTask() {
            when(submissionService.awaitResult(anyString(), any())).thenAnswer(inv ->
                    Optional.of(synthesized(inv.getArgument(0), true)));

            var result = execute("run", "Research and code a limiter", "-r", "research", "-r", "code",
                    "-p", "7", "-c", "data=[1,2,3]", "-c", "owner=platform");

            assertEquals(0, result.exitCode());
            var captor = ArgumentCaptor.forClass(Task.class);
            verify(submissionService).submit(captor.capture());
            Task task = captor.getValue();
            assertEquals(List.of("research", "code"), task.requirements());
            assertEquals(7, task.priority());
            assertEquals(List.of(1, 2, 3), task.context().get("data"));
            assertEquals("platform", task.context().get("owner"));

            assertTrue(result.output().contains("Submitted task " + task.id()));
            assertTrue(result.output().contains("Complexity: simple (0.14)"));
            assertTrue(result.output().contains("[research-1]"));
            assertTrue(result.output().contains("SUCCEEDED, quality 0.70"));
        }

        @Test
        @DisplayName("a failed task prints the error")
        void failedTask() {
            when(submissionService.awaitResult(anyString(), any())).thenAnswer(inv ->
                    Optional.of(synthesized(inv.getArgument(0), false)));

            var result = execute("run", "Research and code a limiter");

            assertTrue(result.output().contains("PARTIALLY_SUCCEEDED"));
            assertTrue(result.output().contains("task-c: compiler crashed"));
        }

        @Test
        @DisplayName("a timeout reports the current status")
        void timeout() {
            when(submissionService.awaitResult(anyString(), any())).thenReturn(Optional.empty());
            when(submissionService.statusOf(anyString())).thenReturn(Optional.of(TaskStatus.RUNNING));

            var result = execute("run", "Slow task", "-t", "1");

            assertTrue(result.output().contains("No result within 1s; task is still RUNNING"));
        }

        @Test
        @DisplayName("an out-of-range priority is refused before submitting")
        void invalidPriority() {
            var result = execute("run", "Anything", "-p", "11");

            assertTrue(result.output().contains("Invalid priority: 11"));
            verify(submissionService, never()).submit(any());
        }

        @Test
        @DisplayName("a missing description is a usage error")
        void missingDescription() {
            var result = execute("run");
            assertNotEquals(0, result.exitCode());
        }

        @Test
        @DisplayName("context values are read as JSON when they parse")
        void parseContext() {
            var parsed = RunCommand.parseContext(Map.of("n", "42", "flag", "true", "name", "alice",
                    "obj", "{\"a\":1}"));

            assertEquals(42, parsed.get("n"));
            assertEquals(true, parsed.get("flag"));
            assertEquals("alice", parsed.get("name"));
            assertEquals(Map.of("a", 1), parsed.get("obj"));
        }
    }

    @Nested
    @DisplayName("agents")
    class AgentsTests {

        @Test
        @DisplayName("lists workers and efficiency totals")
        void listsWorkers() {
            when(orchestrator.workerStatus()).thenReturn(List.of(
                    new WorkerStatus("code-1", "CodeAgent", List.of("code", "debug"), false, 3, 1, 0.75, 0.92, 0)));
            when(orchestrator.efficiencyMetrics()).thenReturn(new EfficiencyMetrics(4, 2, 1, 1, 1.5));

            var result = execute("agents");

            assertTrue(result.output().contains("code-1"));
            assertTrue(result.output().contains("capabilities: code, debug"));
            assertTrue(result.output().contains("Tasks: 4 (simple 2, moderate 1, complex 1), 1.5 agents per task"));
        }

        @Test
        @DisplayName("reports an empty pool")
        void emptyPool() {
            when(orchestrator.workerStatus()).thenReturn(List.of());
            assertTrue(execute("agents").output().contains("No workers registered"));
        }
    }

    @Nested
    @DisplayName("health")
    class HealthTests {

        @Test
        @DisplayName("all UP is operational")
        void allUp() {
            when(healthCheckService.checkAll()).thenReturn(List.of(
                    new HealthStatus("bus", HealthStatus.Status.UP, "5 agent(s) registered", Map.of()),
                    new HealthStatus("workers", HealthStatus.Status.UP, "5 of 5 worker(s) idle", Map.of())));

            var result = execute("health");

            assertTrue(result.output().contains("bus: 5 agent(s) registered"));
            assertTrue(result.output().contains("Overall: all components operational"));
        }

        @Test
        @DisplayName("any DEGRADED or DOWN component is reported")
        void degraded() {
            when(healthCheckService.checkAll()).thenReturn(List.of(
                    new HealthStatus("bus", HealthStatus.Status.UP, "ok", Map.of()),
                    new HealthStatus("reasoning", HealthStatus.Status.DEGRADED, "No reasoning backend", Map.of())));

            var result = execute("health");

            assertTrue(result.output().contains("Overall: one or more components degraded or down"));
        }
    }
}
