package com.agentmesh.core.agent;

import com.agentmesh.core.model.AgentCapability;
import com.agentmesh.core.model.Result;
import com.agentmesh.core.model.Task;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Validates the {@code artifacts} listed in a task's context. An artifact passes when it is
 * non-blank text with balanced brackets.
 */
public final class TestAgent implements WorkerAgent {

    private static final List<AgentCapability> CAPABILITIES = List.of(
            new AgentCapability("test", "Check artifacts for defects", 0.9),
            new AgentCapability("validate", "Verify outputs against expectations", 0.8),
            new AgentCapability("code", "Read source code", 0.3));

    private final String agentId;

    public TestAgent(String agentId) {
        this.agentId = agentId;
    }

    @Override
    public String agentId() {
        return agentId;
    }

    @Override
    public List<AgentCapability> capabilities() {
        return CAPABILITIES;
    }

    @Override
    public Result processTask(Task task) {
        long start = System.nanoTime();
        Object artifacts = task.context().get("artifacts");
        if (!(artifacts instanceof Collection<?> items) || items.isEmpty()) {
            return Result.failure(task.id(), agentId, "No artifacts to validate",
                    Duration.ofNanos(System.nanoTime() - start));
        }

        int passed = 0;
        var failures = new ArrayList<String>();
        int index = 0;
        for (Object artifact : items) {
            String problem = check(artifact);
            if (problem == null) {
                passed++;
            } else {
                failures.add("artifact " + index + ": " + problem);
            }
            index++;
        }

        var payload = Map.of(
                "total", items.size(),
                "passed", passed,
                "failed", failures.size(),
                "failures", List.copyOf(failures));
        var elapsed = Duration.ofNanos(System.nanoTime() - start);
        double quality = (double) passed / items.size();
        if (!failures.isEmpty()) {
            return new Result(task.id(), false, payload, failures.size() + " of " + items.size()
                    + " artifact(s) failed validation", agentId, elapsed, quality, Map.of());
        }
        return Result.success(task.id(), agentId, payload, elapsed, quality);
    }

    /** @return null when the artifact passes, otherwise the problem found */
    static String check(Object artifact) {
        if (!(artifact instanceof CharSequence text) || text.toString().isBlank()) {
            return "empty or not text";
        }
        var open = new ArrayDeque<Character>();
        for (char c : text.toString().toCharArray()) {
            switch (c) {
                case '(', '[', '{' -> open.push(c);
                case ')', ']', '}' -> {
                    if (open.isEmpty() || open.pop() != opening(c)) {
                        return "unbalanced '" + c + "'";
                    }
                }
                default -> { }
            }
        }
        return open.isEmpty() ? null : "unclosed '" + open.peek() + "'";
    }

    private static char opening(char closing) {
        return switch (closing) {
            case ')' -> '(';
            case ']' -> '[';
            default -> '{';
        };
    }
}
