package com.agentmesh.dispatch.cli;

import com.agentmesh.core.events.EventBus;
import com.agentmesh.core.model.Result;
import com.agentmesh.core.model.SubtaskSummary;
import com.agentmesh.core.model.Task;
import com.agentmesh.core.submission.TaskSubmissionService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * CLI command: agentmesh run "&lt;description&gt;"
 * <p>
 * Submits a task, waits for the synthesized result and prints it with one line per subtask.
 * Context values are read as JSON when they parse ({@code -c data=[1,2,3]}), otherwise as text.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run a task through the mesh")
@Component
public class RunCommand implements Runnable {

    private static final ObjectMapper JSON = new ObjectMapper();

    @Parameters(index = "0", description = "What the task should accomplish")
    private String description;

    @Option(names = {"--requirement", "-r"}, description = "A requirement; repeat for several")
    private List<String> requirements = new ArrayList<>();

    @Option(names = {"--priority", "-p"}, description = "Priority 1-10 (default: ${DEFAULT-VALUE})",
            defaultValue = "5")
    private int priority;

    @Option(names = {"--context", "-c"}, description = "Context entry key=value; repeat for several")
    private Map<String, String> context = new LinkedHashMap<>();

    @Option(names = {"--timeout", "-t"}, description = "Seconds to wait for the result (default: ${DEFAULT-VALUE})",
            defaultValue = "120")
    private long timeoutSeconds;

    @Option(names = {"--verbose", "-v"}, description = "Print lifecycle events as they happen")
    private boolean verbose;

    private final TaskSubmissionService submissionService;
    private final EventBus eventBus;

    public RunCommand(TaskSubmissionService submissionService, EventBus eventBus) {
        this.submissionService = submissionService;
        this.eventBus = eventBus;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        if (priority < 1 || priority > 10) {
            ConsoleOutput.error("Invalid priority: " + priority + ". Use a value from 1 to 10");
            return;
        }
        if (description == null || description.isBlank()) {
            ConsoleOutput.error("Task description must not be blank");
            return;
        }

        Task task = Task.of(description, requirements, priority, parseContext(context));
        EventBus.Subscription subscription = verbose ? eventBus.subscribe(task.id(), ConsoleOutput::event) : null;
        try {
            submissionService.submit(task);
            ConsoleOutput.info("Submitted task " + task.id());

            var outcome = submissionService.awaitResult(task.id(), Duration.ofSeconds(timeoutSeconds));
            if (outcome.isEmpty()) {
                ConsoleOutput.error("No result within " + timeoutSeconds + "s; task is still "
                        + submissionService.statusOf(task.id()).map(Enum::name).orElse("unknown"));
                return;
            }
            print(outcome.get());
            submissionService.forget(task.id());
        } finally {
            if (subscription != null) {
                subscription.unsubscribe();
            }
        }
    }

    private static void print(Result result) {
        var metadata = result.metadata();
        ConsoleOutput.info(String.format("Complexity: %s (%.2f) | Agents: %s",
                metadata.get("complexity_type"), ((Number) metadata.getOrDefault("complexity_score", 0.0)).doubleValue(),
                metadata.get("agents_used")));

        System.out.println();
        if (result.payload() instanceof List<?> subtasks) {
            for (Object entry : subtasks) {
                if (entry instanceof SubtaskSummary summary) {
                    ConsoleOutput.subtask(summary);
                    if (summary.payload() != null) {
                        System.out.println("      " + summary.payload());
                    }
                }
            }
        }

        System.out.println(ConsoleOutput.RULE);
        String line = String.format("%s, quality %.2f in %dms", metadata.get("outcome"), result.qualityScore(),
                result.executionTime().toMillis());
        if (result.success()) {
            ConsoleOutput.success(line);
        } else {
            ConsoleOutput.error(line);
            ConsoleOutput.error(result.error());
        }
    }

    static Map<String, Object> parseContext(Map<String, String> raw) {
        var parsed = new HashMap<String, Object>();
        raw.forEach((key, value) -> parsed.put(key, parseValue(value)));
        return parsed;
    }

    private static Object parseValue(String value) {
        try {
            return JSON.readValue(value, Object.class);
        } catch (JsonProcessingException e) {
            return value;
        }
    }
}
